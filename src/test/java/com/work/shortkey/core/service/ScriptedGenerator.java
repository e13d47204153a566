package com.work.shortkey.core.service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.function.IntFunction;

/**
 * 按脚本依次返回候选短键；脚本用完后交给 fallback。记录每次请求的长度。
 */
final class ScriptedGenerator implements ShortKeyGenerator {

    private final Deque<String> script;
    private final IntFunction<String> fallback;
    final List<Integer> requestedLengths = new ArrayList<>();

    ScriptedGenerator(IntFunction<String> fallback, String... candidates) {
        this.script = new ArrayDeque<>(Arrays.asList(candidates));
        this.fallback = fallback;
    }

    @Override
    public synchronized String generate(int length) {
        requestedLengths.add(length);
        String next = script.poll();
        return next != null ? next : fallback.apply(length);
    }

    @Override
    public String newSalt() {
        return "00112233445566778899aabbccddeeff";
    }
}
