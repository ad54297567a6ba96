package com.github.statechart;

import java.util.List;

/**
 * The directory is the abstraction of the storage level: the catalog of state charts by root node
 * id and the live state machines by machine id.
 */
public interface StateChartDirectory {

  /**
   * Saves the chart, replacing a chart with the same id. Running machines keep the chart they were
   * started with.
   */
  void saveStateChart(final StateChart stateChart);

  /**
   * Null if not found.
   */
  StateChart findStateChart(final NodeId chartId);

  List<StateChart> listStateCharts();

  boolean removeStateChart(final NodeId chartId);

  void saveStateMachine(final StateMachine stateMachine);

  /**
   * Null if not found.
   */
  StateMachine findStateMachine(final StateId machineId);

  List<StateMachine> listStateMachines();

  boolean removeStateMachine(final StateId machineId);

}
