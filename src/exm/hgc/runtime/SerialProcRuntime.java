/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.hgc.runtime;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.hgc.common.Logging;
import exm.hgc.ir.tree.Proc;
import exm.hgc.ir.tree.Program;
import exm.hgc.runtime.ProcInterpreter.RunStatus;

/**
 * Runs all procs of a program in discrete ticks on a single thread.
 *
 * Within a tick, procs are visited in program order.  Each proc runs
 * until it completes an activation or blocks; blocked procs are retried
 * while any proc makes progress.  A proc completes at most one activation
 * per tick.
 */
public class SerialProcRuntime {
  private static final Logger logger = Logging.getHGCLogger();

  private final Program program;
  private final ChannelQueueManager queues;
  private final List<ProcInterpreter> interpreters =
                                      new ArrayList<ProcInterpreter>();
  private long tickCount = 0;

  public SerialProcRuntime(Program program) {
    this.program = program;
    this.queues = new ChannelQueueManager(program);
    for (Proc p: program.procs()) {
      interpreters.add(new ProcInterpreter(p, queues));
    }
  }

  public Program program() {
    return program;
  }

  public ChannelQueueManager queueManager() {
    return queues;
  }

  public long tickCount() {
    return tickCount;
  }

  public ProcInterpreter interpreter(String procName) {
    for (ProcInterpreter interp: interpreters) {
      if (interp.proc().name().equals(procName)) {
        return interp;
      }
    }
    return null;
  }

  /**
   * Advance every proc by up to one activation
   * @return true if any proc made progress
   */
  public boolean tick() throws InterpreterException {
    Set<ProcInterpreter> completed = new HashSet<ProcInterpreter>();
    boolean anyProgress = false;
    boolean progress;
    do {
      progress = false;
      for (ProcInterpreter interp: interpreters) {
        if (completed.contains(interp)) {
          continue;
        }
        RunStatus status = interp.run();
        if (status == RunStatus.COMPLETED) {
          completed.add(interp);
          progress = true;
        } else if (status == RunStatus.BLOCKED_AFTER_PROGRESS) {
          progress = true;
        }
      }
      anyProgress |= progress;
    } while (progress);
    tickCount++;
    if (logger.isTraceEnabled()) {
      logger.trace("Tick " + tickCount + ": " + completed.size() + " of " +
                   interpreters.size() + " procs completed an activation");
    }
    return anyProgress;
  }

  /**
   * Tick until each named channel has at least the requested number of
   * values queued
   * @param outputCounts channel name to number of values
   * @return number of ticks run
   * @throws DeadlineExceededException if the counts are not reached within
   *              maxTicks, or if the network stops making progress
   */
  public long tickUntilOutput(Map<String, Long> outputCounts, long maxTicks)
      throws InterpreterException {
    long ticks = 0;
    while (!outputsReady(outputCounts)) {
      if (ticks >= maxTicks) {
        throw new DeadlineExceededException("Outputs " + outputCounts +
                  " not produced within deadline", ticks, blockedChannels());
      }
      boolean progress = tick();
      ticks++;
      if (!progress && !outputsReady(outputCounts)) {
        throw new DeadlineExceededException("No progress toward outputs " +
                  outputCounts, ticks, blockedChannels());
      }
    }
    return ticks;
  }

  private boolean outputsReady(Map<String, Long> outputCounts) {
    for (Map.Entry<String, Long> e: outputCounts.entrySet()) {
      if (queues.getQueueByName(e.getKey()).getSize() < e.getValue()) {
        return false;
      }
    }
    return true;
  }

  /**
   * @return names of channels that procs are waiting on, in proc order
   */
  public List<String> blockedChannels() {
    List<String> result = new ArrayList<String>();
    for (ProcInterpreter interp: interpreters) {
      ChannelQueue q = interp.blockedOn();
      if (q != null && !result.contains(q.name())) {
        result.add(q.name());
      }
    }
    return result;
  }
}
