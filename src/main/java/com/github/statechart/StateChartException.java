package com.github.statechart;

/**
 * Unified single exception that's thrown and handled by the state charts library. The idea is to
 * use the code enum to encapsulate various error/exception conditions. Every code carries a stable
 * numeric id so that callers at the boundary can report it as an {@link ErrorReport}.
 */
public final class StateChartException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public StateChartException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public StateChartException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public StateChartException(final Code code, final Throwable throwable) {
    super(code.getDescription(), throwable);
    this.code = code;
  }

  public StateChartException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  /**
   * Structured {id, message} view of this failure.
   */
  public ErrorReport toErrorReport() {
    return new ErrorReport(code.getId(), getMessage());
  }

  static StateChartException missing(final String attribute) {
    return new StateChartException(Code.MANDATORY_ATTRIBUTE_MISSING,
        "Missing mandatory attribute '" + attribute + "'.");
  }

  public static enum Code {
    MANDATORY_ATTRIBUTE_MISSING(1000, "Missing mandatory attribute"),
    UNEXPECTED_TYPE(1001, "Unexpected type provided"),
    VALIDATION_ERROR(1002, "Input failed validation"),
    INVALID_NODE_ID(1003, "NodeId isn't valid"),
    INVALID_STATE_ID(1004, "StateId isn't valid"),
    NO_ROOT(1005, "State chart has no resolvable default entry chain"),
    INVALID_START_NODE(1006, "Start node must name a direct child of its node"),
    DUPLICATE_NODE_ID(1007, "Node id is used more than once within the state chart"),
    CYCLIC_DEFAULT_ENTRY(1008, "Default entry chain of the state chart is cyclic"),
    UNKNOWN_TARGET(1009, "Transition target cannot be resolved within the state chart"),
    UNDECLARED_VARIABLE(1010, "Variable isn't declared in any enclosing scope of the current state"),
    ACTION_FAILURE(1011, "Action call failed"),
    PREDICATE_FAILURE(1012, "Predicate call failed"),
    UNKNOWN_STATE_CHART(1013, "State chart couldn't be found"),
    UNKNOWN_STATE_MACHINE(1014, "State machine couldn't be found"),
    OPERATION_LOCK_ACQUISITION_FAILURE(1015,
        "Failed to acquire lock to perform requested operation. This is retryable."),
    INVALID_CONFIG(1016, "State chart configuration is invalid");

    private final int id;
    private final String description;

    private Code(final int id, final String description) {
      this.id = id;
      this.description = description;
    }

    public int getId() {
      return id;
    }

    public String getDescription() {
      return description;
    }
  }

}
