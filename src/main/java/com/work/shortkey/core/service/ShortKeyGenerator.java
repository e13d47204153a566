package com.work.shortkey.core.service;

/**
 * 候选短键生成器。实现必须线程安全。
 */
public interface ShortKeyGenerator {

    /**
     * 生成一个长度为 length 的候选短键，每个字符独立随机抽取。
     */
    String generate(int length);

    /**
     * 每次分配附带的审计盐值，不参与字符选择。
     */
    String newSalt();
}
