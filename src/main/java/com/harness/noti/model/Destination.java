package com.harness.noti.model;

public record Destination(long guildId, long channelId) {}
