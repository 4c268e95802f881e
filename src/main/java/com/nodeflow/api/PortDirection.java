package com.nodeflow.api;

public enum PortDirection {
    INPUT,
    OUTPUT
}
