package com.harness.noti.delivery;

public class DeliveryException extends Exception {

  private final DeliveryFailure failure;

  public DeliveryException(DeliveryFailure failure, String message) {
    super(message);
    this.failure = failure;
  }

  public DeliveryException(DeliveryFailure failure, String message, Throwable cause) {
    super(message, cause);
    this.failure = failure;
  }

  public DeliveryFailure failure() {
    return failure;
  }
}
