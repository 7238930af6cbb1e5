package com.gamearr.model;

public enum UpdateType {
    VERSION,
    DLC,
    BETTER_RELEASE
}
