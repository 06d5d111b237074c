package io.github.depot2git.source;

import io.github.depot2git.InvariantViolationException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The basis relation of a depot's streams at one point in time. Construction rejects cycles, so every query can
 * assume a forest.
 */
public final class StreamTree {
    private final Map<Integer, StreamInfo> streams;
    private final Map<Integer, List<Integer>> children;

    private StreamTree(Map<Integer, StreamInfo> streams, Map<Integer, List<Integer>> children) {
        this.streams = streams;
        this.children = children;
    }

    public static StreamTree of(Collection<StreamInfo> infos) throws InvariantViolationException {
        var byNumber = new LinkedHashMap<Integer, StreamInfo>();
        infos.stream()
                .sorted(Comparator.comparingInt(StreamInfo::number))
                .forEach(s -> byNumber.put(s.number(), s));
        var children = new HashMap<Integer, List<Integer>>();
        for (var stream : byNumber.values()) {
            var basis = stream.basisNumber();
            if (basis != null && byNumber.containsKey(basis)) {
                children.computeIfAbsent(basis, k -> new ArrayList<>()).add(stream.number());
            }
        }
        var tree = new StreamTree(byNumber, children);
        tree.checkAcyclic();
        return tree;
    }

    public Optional<StreamInfo> stream(int number) {
        return Optional.ofNullable(streams.get(number));
    }

    public Optional<StreamInfo> byName(String name) {
        return streams.values().stream().filter(s -> s.name().equals(name)).findFirst();
    }

    public Collection<StreamInfo> streams() {
        return streams.values();
    }

    public List<Integer> children(int number) {
        return children.getOrDefault(number, List.of());
    }

    /** Every stream after its basis. Roots and siblings appear in stream-number order. */
    public List<StreamInfo> topologicalOrder() {
        var result = new ArrayList<StreamInfo>(streams.size());
        var queue = new ArrayDeque<Integer>();
        for (var stream : streams.values()) {
            if (stream.basisNumber() == null || !streams.containsKey(stream.basisNumber())) {
                queue.add(stream.number());
            }
        }
        while (!queue.isEmpty()) {
            var number = queue.poll();
            result.add(streams.get(number));
            queue.addAll(children(number));
        }
        return result;
    }

    /** Orders the given stream numbers so that each comes after any of its ancestors in the set. */
    public List<Integer> topologicalOrder(Collection<Integer> subset) {
        var order = new ArrayList<Integer>(subset.size());
        for (var stream : topologicalOrder()) {
            if (subset.contains(stream.number())) {
                order.add(stream.number());
            }
        }
        // streams unknown to this tree keep their relative order at the end
        for (var number : subset) {
            if (!streams.containsKey(number) && !order.contains(number)) {
                order.add(number);
            }
        }
        return order;
    }

    /** True when {@code ancestor} is a strict ancestor of {@code descendant} along the basis chain. */
    public boolean isAncestor(int ancestor, int descendant) {
        var current = streams.get(descendant);
        while (current != null && current.basisNumber() != null) {
            if (current.basisNumber() == ancestor) {
                return true;
            }
            current = streams.get(current.basisNumber());
        }
        return false;
    }

    /** The basis chain of a stream, starting with its immediate basis. */
    public List<StreamInfo> basisChain(int number) {
        var chain = new ArrayList<StreamInfo>();
        var current = streams.get(number);
        while (current != null && current.basisNumber() != null) {
            current = streams.get(current.basisNumber());
            if (current != null) {
                chain.add(current);
            }
        }
        return chain;
    }

    private void checkAcyclic() throws InvariantViolationException {
        for (var start : streams.values()) {
            int steps = 0;
            var current = start;
            while (current != null && current.basisNumber() != null) {
                if (++steps > streams.size()) {
                    throw new InvariantViolationException(
                            "Stream basis relation contains a cycle through " + start.name() + " ("
                                    + start.number() + ")");
                }
                current = streams.get(current.basisNumber());
            }
        }
    }
}
