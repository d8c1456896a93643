package com.webtext.core.model;

/** 입력 한 줄: 0부터 시작하는 줄 위치 + 원문(trim 적용) */
public record UrlItem(int index, String raw) { }
