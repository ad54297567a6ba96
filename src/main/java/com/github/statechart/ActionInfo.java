package com.github.statechart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Information regarding a particular action provided by a {@link CallRegistry}. It cannot be
 * changed by chart authors and exists purely for information purposes.
 */
public final class ActionInfo {
  private final String name;
  private final String description;
  private final List<VariableDeclaration> parameters;

  public ActionInfo(final String name, final String description,
      final List<VariableDeclaration> parameters) {
    this.name = Objects.requireNonNull(name);
    this.description = description == null ? "" : description;
    this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  /**
   * The expected parameters with their types and default values.
   */
  public List<VariableDeclaration> getParameters() {
    return parameters;
  }

  @Override
  public String toString() {
    return "ActionInfo [name=" + name + ", description=" + description + ", parameters="
        + parameters + "]";
  }
}
