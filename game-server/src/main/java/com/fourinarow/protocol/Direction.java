package com.fourinarow.protocol;

public enum Direction {
    INBOUND,
    OUTBOUND
}
