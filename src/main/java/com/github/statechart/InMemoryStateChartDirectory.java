package com.github.statechart;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Directory of all state charts and state machines held in memory. Nothing survives the process.
 */
public final class InMemoryStateChartDirectory implements StateChartDirectory {
  private static final Logger logger =
      LogManager.getLogger(InMemoryStateChartDirectory.class.getSimpleName());

  // K=chart root node id, V=chart
  private final ConcurrentMap<NodeId, StateChart> allStateCharts = new ConcurrentHashMap<>();

  // K=machine id, V=machine
  private final ConcurrentMap<StateId, StateMachine> allStateMachines = new ConcurrentHashMap<>();

  @Override
  public void saveStateChart(final StateChart stateChart) {
    final StateChart replaced = allStateCharts.put(stateChart.getId(), stateChart);
    if (replaced != null) {
      logger.info("Replaced state chart " + stateChart.getId());
    }
  }

  @Override
  public StateChart findStateChart(final NodeId chartId) {
    return allStateCharts.get(chartId);
  }

  @Override
  public List<StateChart> listStateCharts() {
    return new ArrayList<>(allStateCharts.values());
  }

  @Override
  public boolean removeStateChart(final NodeId chartId) {
    return allStateCharts.remove(chartId) != null;
  }

  @Override
  public void saveStateMachine(final StateMachine stateMachine) {
    allStateMachines.put(stateMachine.getId(), stateMachine);
  }

  @Override
  public StateMachine findStateMachine(final StateId machineId) {
    return allStateMachines.get(machineId);
  }

  @Override
  public List<StateMachine> listStateMachines() {
    return new ArrayList<>(allStateMachines.values());
  }

  @Override
  public boolean removeStateMachine(final StateId machineId) {
    return allStateMachines.remove(machineId) != null;
  }

  @Override
  public String toString() {
    return "InMemoryStateChartDirectory [stateCharts=" + allStateCharts.size()
        + ", stateMachines=" + allStateMachines.size() + "]";
  }
}
