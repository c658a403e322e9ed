package com.jasmin.requestguard.models;

import lombok.Value;

/** Authenticated caller as supplied by the identity layer. */
@Value
public class RequestPrincipal {
    String id;
    boolean superuser;
}
