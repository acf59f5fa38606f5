package com.linlay.assistantgw.stream.service;

@FunctionalInterface
public interface TokenCounter {

    int count(String text);
}
