package edu.umich.andykong.glycocorrect.correction;

import edu.umich.andykong.glycocorrect.composition.Composition;
import edu.umich.andykong.glycocorrect.utils.ValueWithUncertainty;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Directed acyclic graph of glycoforms connected by glycation conversions.
 *
 * Nodes and edges are stored in index-addressed lists and never change once the graph is built. Every edge adds a
 * composition delta with a positive total unit count, so the total unit count strictly increases along every path
 * and the graph cannot contain a cycle.
 */
public class GlycationGraph {
    private final ImmutableList<Glycoform> nodes;
    private final ImmutableList<ConversionEdge> edges;
    private final ImmutableList<ImmutableList<ConversionEdge>> outgoing;
    private final ImmutableList<ImmutableList<ConversionEdge>> incoming;
    private final HashMap<Composition, Integer> indexByComposition;

    private GlycationGraph(Builder builder) {
        this.nodes = ImmutableList.copyOf(builder.nodes);
        this.edges = ImmutableList.copyOf(builder.edges);
        ImmutableList.Builder<ImmutableList<ConversionEdge>> out = ImmutableList.builder();
        ImmutableList.Builder<ImmutableList<ConversionEdge>> in = ImmutableList.builder();
        for (int i = 0; i < nodes.size(); i++) {
            out.add(ImmutableList.copyOf(builder.outgoing.get(i)));
            in.add(ImmutableList.copyOf(builder.incoming.get(i)));
        }
        this.outgoing = out.build();
        this.incoming = in.build();
        this.indexByComposition = new HashMap<>(builder.indexByComposition);
    }

    public int size() {
        return nodes.size();
    }

    public List<Glycoform> nodes() {
        return nodes;
    }

    public List<ConversionEdge> edges() {
        return edges;
    }

    public Glycoform node(int index) {
        return nodes.get(index);
    }

    public List<ConversionEdge> outgoingEdges(int index) {
        return outgoing.get(index);
    }

    public List<ConversionEdge> incomingEdges(int index) {
        return incoming.get(index);
    }

    /**
     * @return summed rate of all conversions leaving the node
     */
    public ValueWithUncertainty outgoingRate(int index) {
        ValueWithUncertainty total = ValueWithUncertainty.ZERO;
        for (ConversionEdge edge : outgoing.get(index)) {
            total = total.add(edge.getRate());
        }
        return total;
    }

    /**
     * @return the node with this composition, or null
     */
    public Glycoform find(Composition composition) {
        Integer index = indexByComposition.get(composition);
        return index == null ? null : nodes.get(index);
    }

    /**
     * Kahn's algorithm, always taking the lowest ready index so the order is reproducible.
     * @return node indices such that every edge points from an earlier to a later node
     */
    public int[] topologicalOrder() {
        int[] inDegree = new int[nodes.size()];
        for (ConversionEdge edge : edges) {
            inDegree[edge.getSink()]++;
        }
        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < inDegree.length; i++) {
            if (inDegree[i] == 0) {
                ready.add(i);
            }
        }
        int[] order = new int[nodes.size()];
        int n = 0;
        while (!ready.isEmpty()) {
            int current = ready.poll();
            order[n++] = current;
            for (ConversionEdge edge : outgoing.get(current)) {
                if (--inDegree[edge.getSink()] == 0) {
                    ready.add(edge.getSink());
                }
            }
        }
        if (n != nodes.size()) {
            throw new IllegalStateException("Glycation graph contains a cycle");
        }
        return order;
    }

    /**
     * @return true if {@code order} is a permutation of all node indices in which every edge points forward
     */
    public boolean isTopologicalOrder(int[] order) {
        if (order.length != nodes.size()) {
            return false;
        }
        int[] position = new int[nodes.size()];
        boolean[] seen = new boolean[nodes.size()];
        for (int i = 0; i < order.length; i++) {
            int node = order[i];
            if (node < 0 || node >= nodes.size() || seen[node]) {
                return false;
            }
            seen[node] = true;
            position[node] = i;
        }
        for (ConversionEdge edge : edges) {
            if (position[edge.getSource()] >= position[edge.getSink()]) {
                return false;
            }
        }
        return true;
    }

    public String toString() {
        return String.format("GlycationGraph with %d glycoforms and %d conversions", nodes.size(), edges.size());
    }

    /**
     * Incrementally assembles a {@link GlycationGraph}. Not thread safe; discard after {@link #build()}.
     */
    public static class Builder {
        private final List<Glycoform> nodes = new ArrayList<>();
        private final List<ConversionEdge> edges = new ArrayList<>();
        private final List<List<ConversionEdge>> outgoing = new ArrayList<>();
        private final List<List<ConversionEdge>> incoming = new ArrayList<>();
        private final HashMap<Composition, Integer> indexByComposition = new HashMap<>();
        private final HashSet<Long> connectedPairs = new HashSet<>();

        public Glycoform addNode(Composition composition, String name, ValueWithUncertainty observed,
                                 double theoreticalAbundance, double mass) {
            if (indexByComposition.containsKey(composition)) {
                throw new IllegalArgumentException(String.format("Glycoform %s duplicates the composition (%s) of %s",
                        name, composition, nodes.get(indexByComposition.get(composition)).getName()));
            }
            Glycoform node = new Glycoform(nodes.size(), composition, name, observed, theoreticalAbundance, mass);
            nodes.add(node);
            outgoing.add(new ArrayList<>());
            incoming.add(new ArrayList<>());
            indexByComposition.put(composition, node.getIndex());
            return node;
        }

        public Glycoform addNode(Composition composition, String name, ValueWithUncertainty observed) {
            return addNode(composition, name, observed, 0.0, Double.NaN);
        }

        /**
         * Connect two nodes. The delta is the sink's composition minus the source's.
         * @throws IllegalArgumentException if the delta does not add units or the pair is already connected
         */
        public ConversionEdge addEdge(int source, int sink, ValueWithUncertainty rate) {
            Composition delta = nodes.get(sink).getComposition().subtract(nodes.get(source).getComposition());
            if (delta.totalCount() <= 0) {
                throw new IllegalArgumentException(String.format("Conversion from %s to %s does not add units (%s)",
                        nodes.get(source).getName(), nodes.get(sink).getName(), delta));
            }
            if (!connectedPairs.add(pairKey(source, sink))) {
                throw new IllegalArgumentException(String.format("Glycoforms %s and %s are already connected",
                        nodes.get(source).getName(), nodes.get(sink).getName()));
            }
            ConversionEdge edge = new ConversionEdge(source, sink, delta, rate);
            edges.add(edge);
            outgoing.get(source).add(edge);
            incoming.get(sink).add(edge);
            return edge;
        }

        public int size() {
            return nodes.size();
        }

        public Glycoform node(int index) {
            return nodes.get(index);
        }

        public GlycationGraph build() {
            return new GlycationGraph(this);
        }

        private static long pairKey(int a, int b) {
            return ((long) Math.min(a, b) << 32) | Math.max(a, b);
        }
    }
}
