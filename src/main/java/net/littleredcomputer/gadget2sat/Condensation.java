package net.littleredcomputer.gadget2sat;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.set.hash.TIntHashSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The strong components of an implication graph and the DAG obtained by contracting them.
 * Components are numbered in the order Tarjan's algorithm completes them, and that numbering
 * is a reverse topological order of the condensation: whenever there is an arc from component
 * c to a different component d, d &lt; c. Sinks therefore come first.
 */
public final class Condensation {
    private static final Logger log = LogManager.getFormatterLogger(Condensation.class);
    private final ImplicationGraph graph;
    private final int[] component;  // vertex -> component id
    private final List<int[]> members = new ArrayList<>();
    private final int[][] successors;

    private Condensation(ImplicationGraph graph) {
        this.graph = graph;
        this.component = new int[graph.nVertices()];
        new Tarjan().find();
        successors = new int[members.size()][];
        for (int c = 0; c < members.size(); ++c) {
            TIntHashSet out = new TIntHashSet();
            for (int u : members.get(c)) {
                for (int i = 0; i < graph.outDegree(u); ++i) {
                    int d = component[graph.arc(u, i)];
                    if (d != c) out.add(d);
                }
            }
            int[] s = out.toArray();
            Arrays.sort(s);
            successors[c] = s;
        }
        log.debug("%d vertices, %d arcs, %d strong components", graph.nVertices(), graph.nArcs(), members.size());
    }

    public static Condensation of(ImplicationGraph g) { return new Condensation(g); }

    public ImplicationGraph graph() { return graph; }
    public int nComponents() { return members.size(); }
    public int component(int vertex) { return component[vertex]; }

    /** @return the vertices of component c, ascending */
    public int[] members(int c) { return members.get(c).clone(); }

    /** @return the components reachable from c by a single arc, ascending, excluding c itself */
    public int[] successors(int c) { return successors[c].clone(); }

    int[] successorsQuick(int c) { return successors[c]; }
    int[] membersQuick(int c) { return members.get(c); }

    /**
     * In an implication graph, the complements of the members of a component form another
     * component. The two coincide exactly when the formula is unsatisfiable.
     */
    public int dual(int c) { return component[members.get(c)[0] ^ 1]; }

    /** @return component ids, sinks first */
    public int[] reverseTopologicalOrder() {
        int[] order = new int[members.size()];
        Arrays.setAll(order, i -> i);
        return order;
    }

    // Tarjan's algorithm, in the nonrecursive form of TAOCP 7.4.1.2: each vertex carries a
    // rank, a parent, a min, a link to the next vertex on its stack, and the index of
    // its first untagged arc.
    private class Tarjan {
        private static final int NIL = -1;
        private final int n = graph.nVertices();
        private final int[] rank = new int[n];
        private final int[] parent = new int[n];
        private final int[] min = new int[n];
        private final int[] link = new int[n];
        private final int[] untagged = new int[n];
        private int activeStack = NIL;
        private int nn = 0;

        void find() {
            for (int v = 0; v < n; ++v) {
                if (rank[v] == 0) process(v);
            }
        }

        private void makeActive(int v) {
            rank[v] = ++nn;
            link[v] = activeStack;
            activeStack = v;
            min[v] = v;
        }

        private void process(int v) {
            parent[v] = NIL;
            makeActive(v);
            do {
                // Explore one step from the current vertex v, possibly moving to another current vertex
                // and calling it v
                int u;
                if (untagged[v] < graph.outDegree(v)) {
                    u = graph.arc(v, untagged[v]++);  // u = the tip of the untagged arc from v
                    if (rank[u] != 0) {  // We've seen u already
                        if (rank[u] < rank[min[v]]) min[v] = u;  // non-tree arc, just update min
                    } else {  // u is presently unseen
                        parent[u] = v;  // the arc from v to u is a new tree arc
                        v = u;
                        makeActive(v);
                    }
                } else {  // all arcs from v are tagged, so v matures
                    u = parent[v];
                    if (min[v] == v) {
                        announceComponent(v);
                    } else if (rank[min[v]] < rank[min[u]]) {
                        // The arc from u to v has just matured, making min[v] visible from u
                        min[u] = min[v];
                    }
                    v = u;
                }
            } while (v != NIL);
        }

        private void announceComponent(int v) {
            // Remove v and all its successors on the active stack from the tree,
            // and mark them as a strong component of the graph
            final int id = members.size();
            TIntArrayList c = new TIntArrayList();
            int t = activeStack;
            activeStack = link[v];
            while (true) {
                rank[t] = Integer.MAX_VALUE;  // now t is settled
                component[t] = id;
                c.add(t);
                if (t == v) break;
                t = link[t];
            }
            c.sort();
            members.add(c.toArray());
        }
    }
}
