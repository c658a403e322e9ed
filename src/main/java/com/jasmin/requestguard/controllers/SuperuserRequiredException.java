package com.jasmin.requestguard.controllers;

public class SuperuserRequiredException extends RuntimeException {
    public SuperuserRequiredException() {
        super("Superuser privileges required");
    }
}
