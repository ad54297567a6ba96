package com.github.statechart;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statechart.StateChartException.Code;

/**
 * Entry point for clients: keeps the catalog of state charts, starts machines from them and drives
 * those machines.
 *
 * Calls on the same machine are serialized with a lock per machine id; callers that cannot get the
 * lock within {@link StateChartConfiguration#getLockAcquisitionMillis()} fail with
 * {@link Code#OPERATION_LOCK_ACQUISITION_FAILURE}. Distinct machines run in parallel.
 */
public final class StateChartService {
  private static final Logger logger =
      LogManager.getLogger(StateChartService.class.getSimpleName());

  private final StateChartDirectory directory;
  private final CallRegistry callRegistry;
  private final StateChartConfiguration config;
  private final ChartDocumentReader reader = new ChartDocumentReader();

  // K=machine id, V=lock guarding it
  private final ConcurrentMap<StateId, ReentrantLock> machineLocks = new ConcurrentHashMap<>();

  public StateChartService(final StateChartDirectory directory, final CallRegistry callRegistry,
      final StateChartConfiguration config) {
    this.directory = directory;
    this.callRegistry = callRegistry;
    this.config = config;
    logger.info("Created state chart service with " + config);
  }

  /**
   * Validates the chart and adds it to the catalog, replacing a chart with the same root id.
   *
   * @return the root node id, which is the id of the chart
   */
  public NodeId createStateChart(final ValidatedValue chartValue) throws StateChartException {
    final StateChart stateChart = StateChart.fromValidatedValue(chartValue);
    directory.saveStateChart(stateChart);
    logger.info("Created state chart " + stateChart.getId());
    return stateChart.getId();
  }

  /**
   * Same as {@link #createStateChart(ValidatedValue)} for a YAML or JSON document.
   */
  public NodeId createStateChart(final String document) throws StateChartException {
    return createStateChart(reader.read(document));
  }

  public NodeId updateStateChart(final NodeId chartId, final ValidatedValue chartValue)
      throws StateChartException {
    if (directory.findStateChart(chartId) == null) {
      throw new StateChartException(Code.UNKNOWN_STATE_CHART, "Unknown state chart: " + chartId);
    }
    final StateChart stateChart = StateChart.fromValidatedValue(chartValue);
    if (!stateChart.getId().equals(chartId)) {
      throw new StateChartException(Code.VALIDATION_ERROR,
          "Root id " + stateChart.getId() + " doesn't match state chart " + chartId);
    }
    directory.saveStateChart(stateChart);
    logger.info("Updated state chart " + chartId);
    return chartId;
  }

  public StateChart findStateChart(final NodeId chartId) throws StateChartException {
    final StateChart stateChart = directory.findStateChart(chartId);
    if (stateChart == null) {
      throw new StateChartException(Code.UNKNOWN_STATE_CHART, "Unknown state chart: " + chartId);
    }
    return stateChart;
  }

  public List<NodeId> listStateCharts() {
    final List<NodeId> chartIds = new ArrayList<>();
    for (final StateChart stateChart : directory.listStateCharts()) {
      chartIds.add(stateChart.getId());
    }
    return chartIds;
  }

  public List<ActionInfo> listActions() {
    return callRegistry.listActions();
  }

  /**
   * Starts a new machine running the chart.
   *
   * @return the id of the new machine, naming the chart's root node
   */
  public StateId start(final NodeId chartId) throws StateChartException {
    final StateChart stateChart = findStateChart(chartId);
    final StateMachine machine = StateMachine.start(stateChart, callRegistry, callRegistry,
        new InMemoryStateMachineLog(config.getMaxLogEntries()), config);
    machineLocks.put(machine.getId(), new ReentrantLock(true));
    directory.saveStateMachine(machine);
    logger.info("Started " + machine);
    return machine.getId();
  }

  /**
   * Sends the event to the machine.
   *
   * @return the events enabled in the state the machine rests in afterwards
   */
  public List<String> send(final StateId machineId, final String eventId)
      throws StateChartException {
    final StateMachine machine = lookupMachine(machineId);
    final ReentrantLock lock = acquire(machineId, machine);
    try {
      machine.send(eventId);
      return machine.enabledEvents();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Sets the variable on the machine.
   *
   * @return the events enabled in the state the machine rests in afterwards
   */
  public List<String> setVariable(final StateId machineId, final String name,
      final VariableValue value) throws StateChartException {
    final StateMachine machine = lookupMachine(machineId);
    final ReentrantLock lock = acquire(machineId, machine);
    try {
      machine.setVariable(name, value);
      return machine.enabledEvents();
    } finally {
      lock.unlock();
    }
  }

  public StateId readCurrentState(final StateId machineId) throws StateChartException {
    final StateMachine machine = lookupMachine(machineId);
    final ReentrantLock lock = acquire(machineId, machine);
    try {
      return machine.getCurrentState();
    } finally {
      lock.unlock();
    }
  }

  public List<String> readEnabledEvents(final StateId machineId) throws StateChartException {
    final StateMachine machine = lookupMachine(machineId);
    final ReentrantLock lock = acquire(machineId, machine);
    try {
      return machine.enabledEvents();
    } finally {
      lock.unlock();
    }
  }

  public Map<String, VariableValue> readVariables(final StateId machineId)
      throws StateChartException {
    final StateMachine machine = lookupMachine(machineId);
    final ReentrantLock lock = acquire(machineId, machine);
    try {
      return machine.getVisibleVariables();
    } finally {
      lock.unlock();
    }
  }

  public List<LogEntry> readLog(final StateId machineId) throws StateChartException {
    return lookupMachine(machineId).getLog().entries();
  }

  public StateMachineStatistics readStatistics(final StateId machineId)
      throws StateChartException {
    return lookupMachine(machineId).getStatistics();
  }

  public List<StateId> listStateMachines() {
    final List<StateId> machineIds = new ArrayList<>();
    for (final StateMachine machine : directory.listStateMachines()) {
      machineIds.add(machine.getId());
    }
    return machineIds;
  }

  /**
   * Forgets the machine. Later calls with its id fail with {@link Code#UNKNOWN_STATE_MACHINE}.
   */
  public boolean stop(final StateId machineId) throws StateChartException {
    final StateMachine machine = lookupMachine(machineId);
    final ReentrantLock lock = acquire(machineId, machine);
    try {
      final boolean removed = directory.removeStateMachine(machineId);
      machineLocks.remove(machineId);
      logger.info("Stopped state machine with " + machine.getStatistics());
      return removed;
    } finally {
      lock.unlock();
    }
  }

  private StateMachine lookupMachine(final StateId machineId) throws StateChartException {
    final StateMachine machine = directory.findStateMachine(machineId);
    if (machine == null) {
      throw new StateChartException(Code.UNKNOWN_STATE_MACHINE,
          "Unknown state machine: " + machineId);
    }
    return machine;
  }

  // the machine must still be registered once the lock is held, a stop may have run meanwhile
  private ReentrantLock acquire(final StateId machineId, final StateMachine machine)
      throws StateChartException {
    final ReentrantLock lock = machineLocks.get(machineId);
    if (lock == null) {
      throw new StateChartException(Code.UNKNOWN_STATE_MACHINE,
          "Unknown state machine: " + machineId);
    }
    try {
      if (lock.tryLock(config.getLockAcquisitionMillis(), TimeUnit.MILLISECONDS)) {
        if (directory.findStateMachine(machineId) != machine) {
          lock.unlock();
          throw new StateChartException(Code.UNKNOWN_STATE_MACHINE,
              "State machine was stopped: " + machineId);
        }
        return lock;
      }
    } catch (InterruptedException problem) {
      Thread.currentThread().interrupt();
      throw new StateChartException(Code.OPERATION_LOCK_ACQUISITION_FAILURE, problem);
    }
    throw new StateChartException(Code.OPERATION_LOCK_ACQUISITION_FAILURE,
        "Timed out waiting for state machine " + machineId);
  }

  @Override
  public String toString() {
    return "StateChartService [directory=" + directory + ", config=" + config + "]";
  }
}
