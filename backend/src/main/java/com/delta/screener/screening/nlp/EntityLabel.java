package com.delta.screener.screening.nlp;

public enum EntityLabel {
    PERSON,
    ORG
}
