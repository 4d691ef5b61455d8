package com.example.benchtracker;

import java.io.IOException;

/**
 * No benchmark state could be resolved and there is no auto-detection to wait for one.
 */
public class BenchmarkNotFoundException extends IOException {
    public BenchmarkNotFoundException(String message) {
        super(message);
    }
}
