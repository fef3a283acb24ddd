package org.javai.jobguard.orchestration;

import org.javai.jobguard.Failure;
import org.javai.jobguard.Outcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * A phase made of independent branches whose results are collected in branch order.
 *
 * <p>By default the branches run one after another on the calling thread and the first failing
 * branch stops the fan-out. After {@link #concurrently(Executor)}, every branch is started on the
 * executor and the fan-out waits for all of them before deciding; if any failed, the failure of
 * the lowest-indexed failing branch is returned, so a sibling's success never hides it.
 *
 * <pre>{@code
 * // back up three resource kinds, then continue with all three recovery points
 * Phase<List<JobHandle>, List<String>> awaitAll =
 *     FanOut.each("await backups", Phases.awaitArtifact("await backup", poller, poll));
 * }</pre>
 *
 * @param <I> what the fan-out consumes
 * @param <O> what each branch produces
 */
public final class FanOut<I, O> implements Phase<I, List<O>> {

    private final String name;
    private final Function<I, List<Branch<O>>> branching;
    private final Executor executor;

    private FanOut(String name, Function<I, List<Branch<O>>> branching, Executor executor) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.branching = branching;
        this.executor = executor;
    }

    /**
     * Runs the phase once per input element.
     */
    public static <I, O> FanOut<List<I>, O> each(String name, Phase<? super I, O> phase) {
        Objects.requireNonNull(phase, "phase must not be null");
        return new FanOut<>(name, inputs -> {
            List<Branch<O>> branches = new ArrayList<>(inputs.size());
            for (I input : inputs) {
                branches.add(new Branch<>(phase.name(), () -> phase.run(input)));
            }
            return branches;
        }, null);
    }

    /**
     * Runs every phase on the same input.
     */
    public static <I, O> FanOut<I, O> all(String name, List<? extends Phase<? super I, O>> phases) {
        Objects.requireNonNull(phases, "phases must not be null");
        List<? extends Phase<? super I, O>> copy = List.copyOf(phases);
        return new FanOut<>(name, input -> {
            List<Branch<O>> branches = new ArrayList<>(copy.size());
            for (Phase<? super I, O> phase : copy) {
                branches.add(new Branch<>(phase.name(), () -> phase.run(input)));
            }
            return branches;
        }, null);
    }

    /**
     * Returns a copy of this fan-out that runs its branches on the given executor.
     */
    public FanOut<I, O> concurrently(Executor executor) {
        return new FanOut<>(name, branching, Objects.requireNonNull(executor, "executor must not be null"));
    }

    public boolean isConcurrent() {
        return executor != null;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Outcome<List<O>> run(I input) {
        Objects.requireNonNull(input, "input must not be null");
        List<Branch<O>> branches = branching.apply(input);
        return executor == null ? runSequentially(branches) : runConcurrently(branches);
    }

    private Outcome<List<O>> runSequentially(List<Branch<O>> branches) {
        List<O> results = new ArrayList<>(branches.size());
        for (int i = 0; i < branches.size(); i++) {
            Branch<O> branch = branches.get(i);
            Outcome<O> outcome = branch.run();
            if (outcome instanceof Outcome.Fail<O> fail) {
                return Outcome.fail(branchFailure(i, branch, fail.failure(), branches.size()));
            }
            results.add(outcome.getOrThrow());
        }
        return Outcome.ok(List.copyOf(results));
    }

    private Outcome<List<O>> runConcurrently(List<Branch<O>> branches) {
        List<CompletableFuture<Outcome<O>>> futures = new ArrayList<>(branches.size());
        for (Branch<O> branch : branches) {
            futures.add(CompletableFuture.supplyAsync(branch::run, executor));
        }

        // Join every branch before looking at any result; a branch that threw is rethrown below.
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .exceptionally(e -> null)
                .join();

        List<O> results = new ArrayList<>(branches.size());
        for (int i = 0; i < futures.size(); i++) {
            Outcome<O> outcome = joinBranch(futures.get(i));
            if (outcome instanceof Outcome.Fail<O> fail) {
                return Outcome.fail(branchFailure(i, branches.get(i), fail.failure(), branches.size()));
            }
            results.add(outcome.getOrThrow());
        }
        return Outcome.ok(List.copyOf(results));
    }

    private static <O> Outcome<O> joinBranch(CompletableFuture<Outcome<O>> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    private Failure branchFailure(int index, Branch<O> branch, Failure failure, int branchCount) {
        return failure.withContext(
                name + " branch " + (index + 1) + "/" + branchCount + " (" + branch.name() + "): " + failure.message(),
                Map.of("fanOut", name, "branch", branch.name(), "branchIndex", String.valueOf(index + 1)));
    }

    @Override
    public String toString() {
        return "FanOut[" + name + (executor == null ? ", sequential]" : ", concurrent]");
    }

    private record Branch<O>(String name, Supplier<Outcome<O>> body) {

        Outcome<O> run() {
            return Objects.requireNonNull(body.get(), () -> "branch " + name + " returned null");
        }
    }
}
