package com.example.tssconverter.service.sheet;

public enum SearchDirection {
    DOWN,
    UP
}
