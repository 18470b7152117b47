package com.example.tssconverter.service.extract;

public record ArticlePair(String name, String number) {

    public ArticlePair {
        name = name == null ? "" : name;
        number = number == null ? "" : number;
    }
}
