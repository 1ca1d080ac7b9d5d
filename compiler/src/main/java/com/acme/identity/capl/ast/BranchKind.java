package com.acme.identity.capl.ast;

public enum BranchKind {
    IF,
    ELSE_IF,
    ELSE
}
