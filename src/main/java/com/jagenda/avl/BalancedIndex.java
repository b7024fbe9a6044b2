package com.jagenda.avl;

import com.jagenda.storage.MalformedLinePolicy;
import com.jagenda.storage.Record;
import com.jagenda.storage.RecordLines;
import com.jagenda.storage.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayDeque;
import java.util.ConcurrentModificationException;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * AVL tree storage implementation.
 * Keeps keys in sorted order and the tree height-balanced after every
 * insert and delete, so lookups stay logarithmic whatever the input order.
 *
 * <p>Mutating methods rebuild the affected path recursively: each step
 * returns the new root of its subtree and the caller stores it back into
 * its child link (or the root).
 *
 * <p>Not thread-safe. Callers sharing an index must serialize all access.
 */
public class BalancedIndex implements RecordStore {
    private static final Logger logger = LoggerFactory.getLogger(BalancedIndex.class);

    private Node root;

    // Maintained on every structural change, checked against a traversal in tests
    private int size;

    // One per single rotation; a double rotation adds two
    private long rotationCount;

    // Bumped on structural changes so live iterators can fail fast
    private int modCount;

    // ==================== Height and balance ====================

    static int height(Node node) {
        return node == null ? 0 : node.height;
    }

    static int balanceFactor(Node node) {
        return node == null ? 0 : height(node.left) - height(node.right);
    }

    private static void updateHeight(Node node) {
        node.height = 1 + Math.max(height(node.left), height(node.right));
    }

    // ==================== Rotations ====================

    /**
     * Single right rotation (LL case). {@code z.left} must exist.
     */
    Node rotateRight(Node z) {
        Node y = z.left;
        z.left = y.right;
        y.right = z;

        updateHeight(z);
        updateHeight(y);
        rotationCount++;
        return y;
    }

    /**
     * Single left rotation (RR case). {@code z.right} must exist.
     */
    Node rotateLeft(Node z) {
        Node y = z.right;
        z.right = y.left;
        y.left = z;

        updateHeight(z);
        updateHeight(y);
        rotationCount++;
        return y;
    }

    Node rotateLeftRight(Node z) {
        z.left = rotateLeft(z.left);
        return rotateRight(z);
    }

    Node rotateRightLeft(Node z) {
        z.right = rotateRight(z.right);
        return rotateLeft(z);
    }

    // ==================== Insert ====================

    @Override
    public void write(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        root = insert(root, key, value);
    }

    private Node insert(Node node, String key, String value) {
        if (node == null) {
            size++;
            modCount++;
            return new Node(key, value);
        }

        int cmp = key.compareTo(node.key);
        if (cmp < 0) {
            node.left = insert(node.left, key, value);
        } else if (cmp > 0) {
            node.right = insert(node.right, key, value);
        } else {
            // Same key: replace the value, shape is unchanged
            node.value = value;
            return node;
        }

        updateHeight(node);
        int balance = balanceFactor(node);

        // The inserted key tells which grandchild grew
        if (balance > 1 && key.compareTo(node.left.key) < 0) {
            return rotateRight(node);
        }
        if (balance > 1 && key.compareTo(node.left.key) > 0) {
            return rotateLeftRight(node);
        }
        if (balance < -1 && key.compareTo(node.right.key) > 0) {
            return rotateLeft(node);
        }
        if (balance < -1 && key.compareTo(node.right.key) < 0) {
            return rotateRightLeft(node);
        }
        return node;
    }

    // ==================== Search ====================

    @Override
    public Optional<Record> read(String key) {
        Objects.requireNonNull(key, "key");
        Node found = search(root, key);
        return found == null ? Optional.empty() : Optional.of(new Record(found.key, found.value));
    }

    private static Node search(Node node, String key) {
        if (node == null) {
            return null;
        }
        int cmp = key.compareTo(node.key);
        if (cmp == 0) {
            return node;
        }
        return cmp < 0 ? search(node.left, key) : search(node.right, key);
    }

    // ==================== Delete ====================

    @Override
    public boolean delete(String key) {
        Objects.requireNonNull(key, "key");
        int before = size;
        root = delete(root, key);
        return size < before;
    }

    private Node delete(Node node, String key) {
        if (node == null) {
            return null;
        }

        int cmp = key.compareTo(node.key);
        if (cmp < 0) {
            node.left = delete(node.left, key);
        } else if (cmp > 0) {
            node.right = delete(node.right, key);
        } else {
            if (node.left == null) {
                size--;
                modCount++;
                return node.right;
            }
            if (node.right == null) {
                size--;
                modCount++;
                return node.left;
            }
            // Two children: take over the successor's entry, then remove the successor
            Node successor = findMin(node.right);
            node.key = successor.key;
            node.value = successor.value;
            node.right = delete(node.right, successor.key);
        }

        updateHeight(node);
        int balance = balanceFactor(node);

        // The deleted key is gone, so the child's own balance picks the case
        if (balance > 1 && balanceFactor(node.left) >= 0) {
            return rotateRight(node);
        }
        if (balance > 1 && balanceFactor(node.left) < 0) {
            return rotateLeftRight(node);
        }
        if (balance < -1 && balanceFactor(node.right) <= 0) {
            return rotateLeft(node);
        }
        if (balance < -1 && balanceFactor(node.right) > 0) {
            return rotateRightLeft(node);
        }
        return node;
    }

    static Node findMin(Node node) {
        Node current = node;
        while (current.left != null) {
            current = current.left;
        }
        return current;
    }

    // ==================== Enumeration and statistics ====================

    @Override
    public Iterable<Record> entries() {
        return InOrderIterator::new;
    }

    @Override
    public int count() {
        return size;
    }

    /**
     * @return Height of the whole tree; 0 when empty
     */
    public int height() {
        return height(root);
    }

    /**
     * @return Key currently at the root, if any
     */
    public Optional<String> rootKey() {
        return root == null ? Optional.empty() : Optional.of(root.key);
    }

    public long getRotationCount() {
        return rotationCount;
    }

    public void resetRotationCount() {
        rotationCount = 0;
    }

    /**
     * Drops every node and resets the rotation counter.
     */
    @Override
    public void clear() {
        logger.debug("Clearing index of {} records", size);
        root = null;
        size = 0;
        rotationCount = 0;
        modCount++;
    }

    Node root() {
        return root;
    }

    // ==================== Serialization ====================

    /**
     * Writes every record as a {@code key|value} line in pre-order
     * (node, then left subtree, then right subtree).
     *
     * @param out Destination; not closed
     * @throws IOException If writing fails or a record cannot be represented
     */
    public void serialize(Writer out) throws IOException {
        writePreOrder(root, out);
        out.flush();
    }

    private static void writePreOrder(Node node, Writer out) throws IOException {
        if (node == null) {
            return;
        }
        out.write(RecordLines.format(new Record(node.key, node.value)));
        out.write('\n');
        writePreOrder(node.left, out);
        writePreOrder(node.right, out);
    }

    /**
     * Reads {@code key|value} lines and inserts each one, failing on the first malformed line.
     *
     * @see #deserialize(Reader, MalformedLinePolicy)
     */
    public RecordLines.ParsedLines deserialize(Reader in) throws IOException {
        return deserialize(in, MalformedLinePolicy.FAIL);
    }

    /**
     * Reads {@code key|value} lines and inserts each one. The input is parsed
     * completely before anything is inserted, so a failure leaves the index as it was.
     * The resulting shape generally differs from the one that was serialized;
     * the key to value mapping is the same.
     *
     * @param in Source; not closed
     * @param policy Handling of unparseable lines
     * @return The records read and the number of skipped lines
     * @throws IOException If reading fails, or a line is malformed under FAIL
     */
    public RecordLines.ParsedLines deserialize(Reader in, MalformedLinePolicy policy) throws IOException {
        BufferedReader reader = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
        RecordLines.ParsedLines parsed = RecordLines.parseAll(reader, policy);
        for (Record record : parsed.getRecords()) {
            write(record.getKey(), record.getValue());
        }
        return parsed;
    }

    /**
     * In-order walk with an explicit stack of pending ancestors.
     */
    private final class InOrderIterator implements Iterator<Record> {
        private final Deque<Node> stack = new ArrayDeque<>();
        private final int expectedModCount = modCount;

        InOrderIterator() {
            pushLeftSpine(root);
        }

        private void pushLeftSpine(Node node) {
            while (node != null) {
                stack.push(node);
                node = node.left;
            }
        }

        @Override
        public boolean hasNext() {
            checkForComodification();
            return !stack.isEmpty();
        }

        @Override
        public Record next() {
            checkForComodification();
            if (stack.isEmpty()) {
                throw new NoSuchElementException();
            }
            Node node = stack.pop();
            pushLeftSpine(node.right);
            return new Record(node.key, node.value);
        }

        private void checkForComodification() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException("Index changed during iteration");
            }
        }
    }
}
