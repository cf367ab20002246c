package com.example.milestone.service;

/**
 * fixture の取り込みとパーセンタイル再計算が終わった時点で、取り込み側がプロセス内で発行する。
 */
public record FixtureSeededEvent(long fixtureId) {}
