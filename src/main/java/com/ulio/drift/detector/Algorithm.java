package com.ulio.drift.detector;

public enum Algorithm {
    CUMSUM,
    EWMA
}
