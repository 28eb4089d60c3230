package net.littleredcomputer.gadget2sat;

import gnu.trove.list.array.TIntArrayList;

/**
 * The implication graph of a 2-CNF formula. There are two vertices per variable v,
 * 2v for v and 2v+1 for ~v; the clause (x ∨ y) contributes the arcs ~x → y and ~y → x.
 * Arcs leaving a vertex are kept in ascending order of their tips, which fixes the
 * traversal order of everything built on the graph.
 */
public final class ImplicationGraph {
    private final TIntArrayList[] arcs;
    private final int nArcs;

    private ImplicationGraph(TIntArrayList[] arcs) {
        int n = 0;
        for (TIntArrayList a : arcs) {
            a.sort();
            n += a.size();
        }
        this.arcs = arcs;
        this.nArcs = n;
    }

    private static TIntArrayList[] emptyArcs(int nVertices) {
        TIntArrayList[] arcs = new TIntArrayList[nVertices];
        for (int i = 0; i < nVertices; ++i) arcs[i] = new TIntArrayList();
        return arcs;
    }

    public static ImplicationGraph of(Formula psi) {
        if (psi.kind() != ClauseKind.TWO) throw new IllegalArgumentException("implication graphs need 2-CNF");
        TIntArrayList[] arcs = emptyArcs(2 * psi.nVariables());
        for (Clause c : psi.clauses()) {
            final int x = c.get(0).code();
            final int y = c.get(1).code();
            arcs[x ^ 1].add(y);
            arcs[y ^ 1].add(x);
        }
        return new ImplicationGraph(arcs);
    }

    /**
     * Creates an arbitrary digraph.
     * @param nVertices number of vertices
     * @param arcs taken pairwise, arcs between vertices (considered as a 0-based array)
     */
    static ImplicationGraph fromArcs(int nVertices, int... arcs) {
        if (arcs.length % 2 != 0) throw new IllegalArgumentException("arcs must come in pairs");
        TIntArrayList[] a = emptyArcs(nVertices);
        for (int i = 0; i < arcs.length; i += 2) a[arcs[i]].add(arcs[i + 1]);
        return new ImplicationGraph(a);
    }

    public int nVertices() { return arcs.length; }
    public int nVariables() { return arcs.length / 2; }
    public int nArcs() { return nArcs; }
    public int outDegree(int v) { return arcs[v].size(); }
    public int arc(int v, int i) { return arcs[v].getQuick(i); }
    public int[] successors(int v) { return arcs[v].toArray(); }

    public boolean hasArc(int u, int v) { return arcs[u].binarySearch(v) >= 0; }
}
