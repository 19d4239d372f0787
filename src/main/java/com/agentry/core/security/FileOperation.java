package com.agentry.core.security;

public enum FileOperation {
    READ, WRITE, EXECUTE, VALIDATE
}
