package com.gamearr.model;

public enum CatalogStatus {
    WANTED,
    ACQUIRING,
    ACQUIRED
}
