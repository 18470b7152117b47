package com.example.tssconverter.service.quality;

public enum IssueLevel {
    INFO,
    WARNING,
    ERROR
}
