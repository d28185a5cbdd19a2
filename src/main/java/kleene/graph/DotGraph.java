package kleene.graph;

import java.util.stream.Stream;

/**
 * Automata which can be rendered using the DOT language.
 *
 * @param <V> vertex identifier
 * @param <E> edge label
 */
public interface DotGraph<V, E> {

  /**
   * Vertex in the dot graph.
   *
   * @param id unique identifier for the vertex
   * @param initial does the automaton start in this state?
   * @param accepting is this an accepting state?
   */
  record Vertex<V>(V id, boolean initial, boolean accepting) { }

  /**
   * Edge in the dot graph.
   *
   * @param from vertex where the edge starts
   * @param to vertex where the edge ends
   * @param label label on the edge
   */
  record Edge<V, E>(V from, V to, E label) { }

  /**
   * List out the vertices in the graph.
   *
   * @return all vertices
   */
  Stream<Vertex<V>> vertices();

  /**
   * List out the edges in the graph.
   *
   * @return all edges
   */
  Stream<Edge<V, E>> edges();

  /**
   * Render an edge label.
   *
   * @param edge edge associated with the label
   * @return label text, escaped for an HTML label
   */
  default String renderEdgeLabel(Edge<V, E> edge) {
    final E label = edge.label();
    return label == null ? "" : escapeHtml(label.toString());
  }

  /**
   * Render a vertex label.
   *
   * @param vertex vertex associated with the label
   * @return label text, escaped for an HTML label
   */
  default String renderVertexLabel(Vertex<V> vertex) {
    return escapeHtml(vertex.id().toString());
  }

  /**
   * Render the graph into its DOT source.
   *
   * Initial states get an incoming arrow from an invisible vertex.
   *
   * @param name title given to the graph
   * @return source code for the graph
   */
  default String dotGraph(String name) {
    final var builder = new StringBuilder();
    builder.append("digraph " + escapeId(name) + " {\n");
    builder.append("  rankdir = LR;\n");

    int entries = 0;
    final var entryEdges = new StringBuilder();

    // Vertices
    final Iterable<Vertex<V>> vs = () -> vertices().iterator();
    for (Vertex<V> vertex : vs) {
      final var id = escapeId(vertex.id().toString());
      final var shape = vertex.accepting() ? "doublecircle" : "circle";
      final var label = renderVertexLabel(vertex);
      builder.append("  " + id + " [shape = " + shape + ", label = <" + label + ">];\n");

      if (vertex.initial()) {
        final var entryId = escapeId("_entry" + ++entries);
        builder.append("  " + entryId + " [shape = none, label = <>];\n");
        entryEdges.append("  " + entryId + " -> " + id + ";\n");
      }
    }
    builder.append(entryEdges);

    // Edges
    final Iterable<Edge<V, E>> es = () -> edges().iterator();
    for (Edge<V, E> edge : es) {
      final var from = escapeId(edge.from().toString());
      final var to = escapeId(edge.to().toString());
      final var label = renderEdgeLabel(edge);
      builder.append("  " + from + " -> " + to + " [label = <" + label + ">];\n");
    }

    builder.append("}");
    return builder.toString();
  }

  /**
   * Turn a string into a Dot ID.
   *
   * <p>As per the docs, an ID can be "any double-quoted string ("...") possibly
   * containing escaped quotes (\")".
   *
   * @param str string to escape into an ID
   */
  private static String escapeId(String str) {
    return "\"" + str.replace("\"", "\\\"") + "\"";
  }

  private static String escapeHtml(String str) {
    return str.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
  }
}
