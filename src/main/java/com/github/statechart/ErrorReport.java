package com.github.statechart;

import java.util.Objects;

/**
 * The structured error handed to the response side: a stable numeric id plus a message.
 */
public final class ErrorReport {
  private final int id;
  private final String message;

  public ErrorReport(final int id, final String message) {
    this.id = id;
    this.message = message;
  }

  public int getId() {
    return id;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ErrorReport)) {
      return false;
    }
    ErrorReport other = (ErrorReport) obj;
    return id == other.id && Objects.equals(message, other.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, message);
  }

  @Override
  public String toString() {
    return "ErrorReport [id=" + id + ", message=" + message + "]";
  }
}
