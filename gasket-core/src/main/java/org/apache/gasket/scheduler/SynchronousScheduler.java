/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.gasket.scheduler;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.gasket.conf.GasConfiguration;
import org.apache.gasket.graph.Edge;
import org.apache.gasket.graph.EdgeDirection;
import org.apache.gasket.graph.GraphStore;
import org.apache.gasket.graph.Vertex;
import org.apache.gasket.program.DefaultRoundContext;
import org.apache.gasket.program.RoundContext;
import org.apache.gasket.program.VertexProgram;
import org.apache.gasket.time.SystemTime;
import org.apache.gasket.time.Time;
import org.apache.gasket.time.Times;
import org.apache.gasket.utils.TimedLogger;
import org.apache.hadoop.io.Writable;
import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Bulk synchronous {@link ActivationScheduler}. Each round runs three
 * phases over the active set on a fixed thread pool, with a barrier after
 * each:
 * <ol>
 *   <li>gather: every active vertex folds the contributions of its gather
 *   edges; no vertex value changes during this phase</li>
 *   <li>apply: every active vertex updates its own value</li>
 *   <li>scatter: activation requests are collected per task</li>
 * </ol>
 * The per-task requests are then merged into the next active set. The
 * active set is split into contiguous chunks of vertex indices, so every
 * vertex is applied by exactly one task. The gather of a vertex is folded
 * in edge order by one task, which makes the results independent of the
 * number of threads and chunks.
 *
 * @param <V> Vertex value
 * @param <G> Gather result
 */
public class SynchronousScheduler<V extends Writable, G>
    implements ActivationScheduler<V> {
  /** Class logger */
  private static final Logger LOG =
      Logger.getLogger(SynchronousScheduler.class);

  /** Configuration */
  private final GasConfiguration conf;
  /** Graph */
  private final GraphStore<V> graph;
  /** Vertex program */
  private final VertexProgram<V, G> program;
  /** Time source */
  private final Time time;
  /** Number of compute threads */
  private final int numThreads;
  /** Maximum number of chunks per phase */
  private final int numPartitions;
  /** Round ceiling, negative for none */
  private final int maxRounds;
  /** Time ceiling, negative for none */
  private final long maxRunSeconds;
  /** Progress logging */
  private final TimedLogger progressLogger;
  /** Round observers */
  private final List<RoundObserver> observers = Lists.newArrayList();
  /** Vertices active in the upcoming round */
  private ActiveSet activeSet;
  /** Apply invocations */
  private final AtomicLong numUpdates = new AtomicLong();
  /** Start of the run, valid once started */
  private volatile long startNanos;
  /** Elapsed time of a finished run */
  private volatile double finishedSeconds = -1;
  /** Has the run started? */
  private volatile boolean started = false;

  /**
   * Constructor using the system clock.
   *
   * @param conf Configuration
   * @param graph Graph
   * @param program Vertex program
   */
  public SynchronousScheduler(GasConfiguration conf, GraphStore<V> graph,
      VertexProgram<V, G> program) {
    this(conf, graph, program, SystemTime.get());
  }

  /**
   * Constructor. Validates the settings and initializes the program.
   *
   * @param conf Configuration
   * @param graph Graph
   * @param program Vertex program
   * @param time Time source
   */
  public SynchronousScheduler(GasConfiguration conf, GraphStore<V> graph,
      VertexProgram<V, G> program, Time time) {
    this.conf = Preconditions.checkNotNull(conf, "conf");
    this.graph = Preconditions.checkNotNull(graph, "graph");
    this.program = Preconditions.checkNotNull(program, "program");
    this.time = Preconditions.checkNotNull(time, "time");
    numThreads = conf.getNumComputeThreads();
    Preconditions.checkArgument(numThreads >= 1,
        "SynchronousScheduler: %s must be at least 1, got %s",
        GasConfiguration.NUM_COMPUTE_THREADS.getKey(), numThreads);
    numPartitions = conf.getNumPartitions();
    Preconditions.checkArgument(numPartitions >= 1,
        "SynchronousScheduler: %s must be at least 1, got %s",
        GasConfiguration.NUM_PARTITIONS.getKey(), numPartitions);
    maxRounds = conf.getMaxRounds();
    maxRunSeconds = conf.getMaxRunSeconds();
    progressLogger = new TimedLogger(
        GasConfiguration.PROGRESS_LOG_MSECS.get(conf), LOG, time);
    program.initialize(conf);
    activeSet = new ActiveSet(graph.getNumVertices());
  }

  @Override
  public void signal(long id) {
    Preconditions.checkState(!started, "signal: Run already started");
    int index = graph.indexOf(id);
    Preconditions.checkArgument(index >= 0,
        "signal: Vertex %s is not in the graph", id);
    activeSet.activate(index);
  }

  @Override
  public void signalAll() {
    Preconditions.checkState(!started, "signalAll: Run already started");
    activeSet.activateAll();
  }

  @Override
  public void addRoundObserver(RoundObserver observer) {
    observers.add(observer);
  }

  @Override
  public RunSummary start() {
    Preconditions.checkState(!started, "start: Run already started");
    startNanos = time.getNanoseconds();
    started = true;
    if (LOG.isInfoEnabled()) {
      LOG.info("start: Running " + program.getClass().getSimpleName() +
          " on " + graph.getNumVertices() + " vertices and " +
          graph.getNumEdges() + " edges with " + numThreads +
          " threads, " + activeSet.size() + " vertices initially active");
    }
    ExecutorService executor = Executors.newFixedThreadPool(numThreads,
        new ThreadFactoryBuilder().setNameFormat("gas-compute-%d")
            .setDaemon(true).build());
    int round = 0;
    TerminationReason reason;
    try {
      while (true) {
        if (activeSet.isEmpty()) {
          reason = TerminationReason.CONVERGED;
          break;
        }
        if (maxRounds >= 0 && round >= maxRounds) {
          reason = TerminationReason.MAX_ROUNDS;
          break;
        }
        if (maxRunSeconds >= 0 &&
            Times.getSecondsSinceNanos(time, startNanos) >= maxRunSeconds) {
          reason = TerminationReason.MAX_TIME;
          break;
        }
        ++round;
        activeSet = runRound(executor, round);
      }
    } finally {
      executor.shutdownNow();
    }
    finishedSeconds = Times.getSecondsSinceNanos(time, startNanos);
    RunSummary summary =
        new RunSummary(round, numUpdates.get(), finishedSeconds, reason);
    if (LOG.isInfoEnabled()) {
      LOG.info("start: Finished " + summary);
    }
    return summary;
  }

  @Override
  public long getNumUpdates() {
    return numUpdates.get();
  }

  @Override
  public double getElapsedSeconds() {
    if (finishedSeconds >= 0) {
      return finishedSeconds;
    }
    return started ? Times.getSecondsSinceNanos(time, startNanos) : 0;
  }

  /**
   * Run one round over the current active set.
   *
   * @param executor Thread pool
   * @param round Round number
   * @return Active set of the next round
   */
  private ActiveSet runRound(ExecutorService executor, int round) {
    long roundStartMs = time.getMilliseconds();
    final RoundContext context =
        new DefaultRoundContext(round, graph.getNumVertices(), conf);
    final int[] indices = activeSet.toArray();
    final int numChunks = Math.min(numPartitions, indices.length);
    final int[] bounds = new int[numChunks + 1];
    for (int chunk = 0; chunk <= numChunks; ++chunk) {
      bounds[chunk] = (int) ((long) indices.length * chunk / numChunks);
    }

    @SuppressWarnings("unchecked")
    final G[] totals = (G[]) new Object[indices.length];
    final long[] edgesGathered = new long[numChunks];
    runPhase(executor, "gather", bounds, new ChunkTask() {
      @Override
      public void run(int chunk, int start, int end) {
        long edges = 0;
        for (int i = start; i < end; ++i) {
          Vertex<V> vertex = graph.getVertexAt(indices[i]);
          EdgeDirection direction = program.getGatherEdges(context, vertex);
          G total = program.gatherIdentity();
          for (Edge<V> edge : graph.getEdges(vertex, direction)) {
            total = program.combine(total,
                program.gather(context, vertex, edge));
            ++edges;
          }
          totals[i] = total;
        }
        edgesGathered[chunk] = edges;
      }
    });

    runPhase(executor, "apply", bounds, new ChunkTask() {
      @Override
      public void run(int chunk, int start, int end) {
        for (int i = start; i < end; ++i) {
          program.apply(context, graph.getVertexAt(indices[i]), totals[i]);
          totals[i] = null;
        }
        numUpdates.addAndGet(end - start);
      }
    });

    final IntArrayList[] requests = new IntArrayList[numChunks];
    runPhase(executor, "scatter", bounds, new ChunkTask() {
      @Override
      public void run(int chunk, int start, int end) {
        IntArrayList chunkRequests = new IntArrayList();
        for (int i = start; i < end; ++i) {
          Vertex<V> vertex = graph.getVertexAt(indices[i]);
          EdgeDirection direction = program.getScatterEdges(context, vertex);
          for (Edge<V> edge : graph.getEdges(vertex, direction)) {
            if (program.scatter(context, vertex, edge)) {
              Vertex<V> other = edge.getSource() == vertex ?
                  edge.getTarget() : edge.getSource();
              chunkRequests.add(other.getIndex());
            }
          }
        }
        requests[chunk] = chunkRequests;
      }
    });

    ActiveSet next = new ActiveSet(graph.getNumVertices());
    long numRequests = 0;
    for (IntArrayList chunkRequests : requests) {
      numRequests += chunkRequests.size();
      for (int i = 0; i < chunkRequests.size(); ++i) {
        next.activate(chunkRequests.getInt(i));
      }
    }
    long edges = 0;
    for (long chunkEdges : edgesGathered) {
      edges += chunkEdges;
    }

    RoundStats stats = new RoundStats(round, indices.length, edges,
        numRequests, next.size(), Times.getMsSince(time, roundStartMs));
    if (LOG.isDebugEnabled()) {
      LOG.debug("runRound: " + stats);
    }
    progressLogger.info("runRound: Finished round " + round + " with " +
        indices.length + " active vertices, " + next.size() +
        " active next, " + numUpdates.get() + " updates so far");
    for (RoundObserver observer : observers) {
      observer.postRound(stats);
    }
    return next;
  }

  /**
   * Run a task per chunk on the pool and wait for all of them.
   *
   * @param executor Thread pool
   * @param phase Phase name for error messages
   * @param bounds Chunk boundaries, one more than the number of chunks
   * @param task Task to run on each chunk
   */
  private static void runPhase(ExecutorService executor, String phase,
      final int[] bounds, final ChunkTask task) {
    int numChunks = bounds.length - 1;
    final CountDownLatch latch = new CountDownLatch(numChunks);
    final AtomicReference<Throwable> exception =
        new AtomicReference<Throwable>();
    for (int chunk = 0; chunk < numChunks; ++chunk) {
      final int chunkId = chunk;
      executor.execute(new Runnable() {
        @Override
        public void run() {
          try {
            task.run(chunkId, bounds[chunkId], bounds[chunkId + 1]);
          // CHECKSTYLE: stop IllegalCatch
          // Any failure of a task fails the run
          } catch (Throwable t) {
          // CHECKSTYLE: resume IllegalCatch
            LOG.error("runPhase: " + phase + " task on chunk " + chunkId +
                " failed", t);
            exception.compareAndSet(null, t);
          } finally {
            latch.countDown();
          }
        }
      });
    }

    try {
      latch.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(
          "runPhase: " + phase + " interrupted", e);
    }

    if (exception.get() != null) {
      throw new IllegalStateException(
          "runPhase: " + phase + " Worker failed", exception.get());
    }
  }

  /**
   * Work on a contiguous range of the active vertex indices.
   */
  private interface ChunkTask {
    /**
     * Process one chunk.
     *
     * @param chunk Chunk number
     * @param start First position, inclusive
     * @param end Last position, exclusive
     */
    void run(int chunk, int start, int end);
  }
}
