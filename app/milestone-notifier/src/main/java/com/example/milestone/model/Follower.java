package com.example.milestone.model;

/** エンティティをフォローするユーザーと、プロフィール上の IANA タイムゾーン。 */
public record Follower(String userId, String timezone) {}
