package com.example.est.tomography;

import java.util.stream.IntStream;

final class AngleStreams {

    private AngleStreams() {
    }

    static IntStream parallele(IntStream stream, boolean parallel) {
        return parallel ? stream.parallel() : stream;
    }
}
