package com.harness.noti.schedule;

/** Told about every occurrence a task resolved, after its progress was stored. */
@FunctionalInterface
public interface DispatchListener {

  void resolved(DispatchEvent event);
}
