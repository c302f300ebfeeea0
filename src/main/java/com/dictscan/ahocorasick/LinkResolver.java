package com.dictscan.ahocorasick;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayDeque;
import java.util.Queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the suffix (failure) link and the dictionary suffix (output)
 * link of every non-root node of a fully built trie.
 */
final class LinkResolver {
  private static final Logger log = LoggerFactory.getLogger(LinkResolver.class);

  private final NodeStore store;

  LinkResolver(NodeStore store) {
    this.store = checkNotNull(store);
  }

  /**
   * Visits the trie level by level. Order dependent: a node's suffix link
   * is computed from its parent's, and the transitions taken along the
   * way only touch shallower nodes, whose links are already final.
   */
  void resolve() {
    Queue<Integer> queue = new ArrayDeque<>();
    for (int child : this.store.get(NodeStore.ROOT).getChildren().targets()) {
      queue.add(child);
    }

    int resolved = 0;
    while (!queue.isEmpty()) {
      int current = queue.remove();
      Node node = this.store.get(current);
      for (int child : node.getChildren().targets()) {
        queue.add(child);
      }
      node.setSuffixLink(findSuffixLink(node));
      node.setDictSuffixLink(findDictSuffixLink(node));
      ++resolved;
    }
    log.debug("Resolved links of {} node(s)", resolved);
  }

  private int findSuffixLink(Node node) {
    if (node.getParent() == NodeStore.ROOT) return NodeStore.ROOT;
    int parentLink = this.store.get(node.getParent()).getSuffixLink();
    return this.store.transition(parentLink, node.getSymbol());
  }

  // Requires node's own suffix link to be set. The suffix node is
  // shallower, so its dictionary suffix link is already final and stands
  // for the rest of the chain.
  private int findDictSuffixLink(Node node) {
    int link = node.getSuffixLink();
    if (link == NodeStore.ROOT) return NodeStore.NO_NODE;
    Node suffix = this.store.get(link);
    return suffix.isTerminal() ? link : suffix.getDictSuffixLink();
  }
}
