package io.intellixity.querywall.ontology;

import io.intellixity.querywall.plan.JoinEdge;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Undirected join graph over table names, checked for cycles with union-find.\n
 *
 * Repeating the same edge (in either direction) is redundant, not a cycle.\n
 */
public final class JoinGraph {
  private final Map<String, String> parent = new HashMap<>();
  private final Set<String> seenEdges = new HashSet<>();
  private boolean cyclic;

  public static JoinGraph of(Collection<String> tables, Collection<JoinEdge> joins) {
    JoinGraph g = new JoinGraph();
    if (tables != null) for (String t : tables) g.node(t);
    if (joins != null) for (JoinEdge j : joins) g.edge(j);
    return g;
  }

  public boolean isAcyclic() {
    return !cyclic;
  }

  public int nodeCount() {
    return parent.size();
  }

  private void node(String table) {
    if (table == null) return;
    parent.putIfAbsent(norm(table), norm(table));
  }

  private void edge(JoinEdge j) {
    if (!seenEdges.add(j.undirectedKey())) return;
    String a = norm(j.from());
    String b = norm(j.to());
    node(a);
    node(b);
    String ra = find(a);
    String rb = find(b);
    if (ra.equals(rb)) {
      cyclic = true;
      return;
    }
    parent.put(ra, rb);
  }

  private String find(String x) {
    String root = x;
    while (!parent.get(root).equals(root)) root = parent.get(root);
    // path compression
    String cur = x;
    while (!cur.equals(root)) {
      String next = parent.get(cur);
      parent.put(cur, root);
      cur = next;
    }
    return root;
  }

  private static String norm(String table) {
    return table.trim().toLowerCase(Locale.ROOT);
  }
}
