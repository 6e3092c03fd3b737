package com.scicalc.mathfrontend.engine;

public enum ComputationMode {
    NUMERIC,
    SYMBOLIC
}
