package com.jagenda.avl;

/**
 * One vertex of the AVL tree. A node owns its two subtrees; there is no parent link.
 * Key and value are mutable because deleting a node with two children
 * moves its in-order successor's entry into it.
 */
final class Node {
    String key;
    String value;
    // leaf = 1, an absent child counts as 0
    int height;
    Node left;
    Node right;

    Node(String key, String value) {
        this.key = key;
        this.value = value;
        this.height = 1;
    }
}
