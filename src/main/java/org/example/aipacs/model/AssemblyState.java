package org.example.aipacs.model;

public enum AssemblyState {
    COLLECTING,
    READY,
    CLOSED
}
