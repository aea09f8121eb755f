package com.harness.noti.repository;

import com.harness.noti.interval.IntervalUnit;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "noti", indexes = {
    @Index(name = "idx_guild", columnList = "guild_id"),
    @Index(name = "idx_time", columnList = "start_time"),
    @Index(name = "idx_repeating", columnList = "is_repeating")
})
public class NotificationEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false, updatable = false)
  private Long id;

  @Column(name = "guild_id", nullable = false, updatable = false)
  private long guildId;

  @Column(name = "channel_id", nullable = false, updatable = false)
  private long channelId;

  @Column(name = "user_id", nullable = false, updatable = false)
  private long userId;

  @Column(name = "start_time", nullable = false, updatable = false)
  private Instant startTime;

  @Lob
  @Column(name = "message", nullable = false, updatable = false)
  private String message;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "is_repeating", nullable = false, updatable = false)
  private boolean repeating;

  @Column(name = "interval_value", updatable = false)
  private Long intervalValue;

  @Convert(converter = IntervalUnitConverter.class)
  @Column(name = "interval_unit", length = 1, updatable = false)
  private IntervalUnit intervalUnit;

  @Column(name = "end_time", updatable = false)
  private Instant endTime;

  @Column(name = "last_triggered")
  private Instant lastTriggered;

  @Column(name = "max_occurrences")
  private Integer maxOccurrences;

  public NotificationEntity() {}

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public long getGuildId() {
    return guildId;
  }

  public void setGuildId(long guildId) {
    this.guildId = guildId;
  }

  public long getChannelId() {
    return channelId;
  }

  public void setChannelId(long channelId) {
    this.channelId = channelId;
  }

  public long getUserId() {
    return userId;
  }

  public void setUserId(long userId) {
    this.userId = userId;
  }

  public Instant getStartTime() {
    return startTime;
  }

  public void setStartTime(Instant startTime) {
    this.startTime = startTime;
  }

  public String getMessage() {
    return message;
  }

  public void setMessage(String message) {
    this.message = message;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }

  public boolean isRepeating() {
    return repeating;
  }

  public void setRepeating(boolean repeating) {
    this.repeating = repeating;
  }

  public Long getIntervalValue() {
    return intervalValue;
  }

  public void setIntervalValue(Long intervalValue) {
    this.intervalValue = intervalValue;
  }

  public IntervalUnit getIntervalUnit() {
    return intervalUnit;
  }

  public void setIntervalUnit(IntervalUnit intervalUnit) {
    this.intervalUnit = intervalUnit;
  }

  public Instant getEndTime() {
    return endTime;
  }

  public void setEndTime(Instant endTime) {
    this.endTime = endTime;
  }

  public Instant getLastTriggered() {
    return lastTriggered;
  }

  public void setLastTriggered(Instant lastTriggered) {
    this.lastTriggered = lastTriggered;
  }

  public Integer getMaxOccurrences() {
    return maxOccurrences;
  }

  public void setMaxOccurrences(Integer maxOccurrences) {
    this.maxOccurrences = maxOccurrences;
  }
}
