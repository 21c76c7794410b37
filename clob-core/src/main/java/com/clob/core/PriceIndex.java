package com.clob.core;

import org.agrona.collections.Long2ObjectHashMap;

/**
 * <h1>PriceIndex: A Red-Black Tree of Price Levels</h1>
 *
 * <p>
 * Keeps the distinct prices of one side of the book in order so that the best
 * price, and the next best after it, are found in <b>O(log N)</b> where N is
 * the number of price levels (not the number of orders).
 * </p>
 *
 * <h2>Nodes</h2>
 * <p>
 * Each price owns exactly one {@link Node} that knows its own left, right and
 * parent. Nodes are registered in a primitive {@link Long2ObjectHashMap} keyed
 * by price, so a price can be found without walking the tree. Deletion of a
 * node with two children physically swaps it with its in-order successor
 * instead of copying keys, so a price never changes node.
 * </p>
 *
 * <h2>The Rules of the Red-Black Game</h2>
 * <ol>
 * <li><b>Every node is either RED or BLACK.</b></li>
 * <li><b>The Root is always BLACK.</b></li>
 * <li><b>No two RED nodes can be neighbors.</b></li>
 * <li><b>Every path from Root to Leaf has the same number of BLACK nodes.</b></li>
 * </ol>
 *
 * <p>
 * Price {@code 0} is never a valid price and doubles as {@link #EMPTY}: it is
 * what {@link #min()}, {@link #max()}, {@link #successor(long)} and
 * {@link #predecessor(long)} return when there is nothing to return.
 * </p>
 */
public class PriceIndex {

    public static final long EMPTY = 0;

    private static final boolean RED = true;
    private static final boolean BLACK = false;

    /**
     * A tree node. Exposed read-only for structural checks in tests.
     */
    public static final class Node {
        final long price;
        Node left;
        Node right;
        Node parent;
        boolean color = RED;

        Node(long price) {
            this.price = price;
        }

        public long price() {
            return price;
        }

        public Node left() {
            return left;
        }

        public Node right() {
            return right;
        }

        public Node parent() {
            return parent;
        }

        public boolean isRed() {
            return color == RED;
        }
    }

    private final Long2ObjectHashMap<Node> nodes = new Long2ObjectHashMap<>();
    private Node root;

    /**
     * @return The root node, or {@code null} for an empty index.
     */
    public Node getRoot() {
        return root;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return root == null;
    }

    /**
     * A price is present when it is the root or is hanging off a parent.
     */
    public boolean exists(long price) {
        if (price == EMPTY || root == null) {
            return false;
        }
        if (root.price == price) {
            return true;
        }
        Node node = nodes.get(price);
        return node != null && node.parent != null;
    }

    /**
     * @return The lowest price (Best Ask), or {@link #EMPTY}.
     */
    public long min() {
        return root == null ? EMPTY : minimum(root).price;
    }

    /**
     * @return The highest price (Best Bid), or {@link #EMPTY}.
     */
    public long max() {
        return root == null ? EMPTY : maximum(root).price;
    }

    /**
     * @return The next higher price, or {@link #EMPTY} if {@code price} is the maximum.
     * @throws OrderBookException PRICE_NOT_FOUND if {@code price} is not in the index.
     */
    public long successor(long price) {
        Node next = successor(require(price));
        return next == null ? EMPTY : next.price;
    }

    /**
     * @return The next lower price, or {@link #EMPTY} if {@code price} is the minimum.
     * @throws OrderBookException PRICE_NOT_FOUND if {@code price} is not in the index.
     */
    public long predecessor(long price) {
        Node previous = predecessor(require(price));
        return previous == null ? EMPTY : previous.price;
    }

    /**
     * Inserts a price and rebalances. Inserting a price that is already present
     * is a no-op.
     */
    public void insert(long price) {
        if (price == EMPTY) {
            throw new OrderBookException(OrderBookException.Reason.INVALID_PRICE, "price 0 cannot be indexed");
        }
        if (exists(price)) {
            return;
        }

        Node node = new Node(price);

        if (root == null) {
            root = node;
            root.color = BLACK;
            nodes.put(price, node);
            return;
        }

        // Standard BST descent
        Node current = root;
        Node parent = null;
        while (current != null) {
            parent = current;
            current = price < current.price ? current.left : current.right;
        }

        node.parent = parent;
        if (price < parent.price) {
            parent.left = node;
        } else {
            parent.right = node;
        }
        nodes.put(price, node);

        rebalanceAfterInsertion(node);
    }

    /**
     * Removes a price and restores the red-black rules.
     *
     * @throws OrderBookException PRICE_NOT_FOUND if {@code price} is not in the index.
     */
    public void remove(long price) {
        Node node = require(price);
        deleteNode(node);
        nodes.remove(price);
    }

    private Node require(long price) {
        if (!exists(price)) {
            throw new OrderBookException(OrderBookException.Reason.PRICE_NOT_FOUND, "price " + price);
        }
        return nodes.get(price);
    }

    // =========================================================================
    // INSERTION FIXUP
    // =========================================================================

    /**
     * Restores the rules after a new RED node is inserted.
     * <ul>
     * <li><b>Uncle is RED:</b> flip colors, move the problem to the grandparent.</li>
     * <li><b>Zig-zag:</b> rotate the parent to turn it into a line.</li>
     * <li><b>Line:</b> recolor and rotate the grandparent.</li>
     * </ul>
     */
    private void rebalanceAfterInsertion(Node node) {
        node.color = RED;

        // Double red: the parent is RED too
        while (node != null && node != root && isRed(node.parent)) {
            // Parent is the LEFT child of the grandparent
            if (parentOf(node) == leftOf(grandparentOf(node))) {
                Node uncle = rightOf(grandparentOf(node));

                if (isRed(uncle)) {
                    // Uncle is RED: recolor
                    setColor(parentOf(node), BLACK);
                    setColor(uncle, BLACK);
                    setColor(grandparentOf(node), RED);
                    node = grandparentOf(node); // Problem moves up to the grandparent
                } else {
                    if (node == rightOf(parentOf(node))) {
                        // Zig-zag: straighten into a line
                        node = parentOf(node);
                        rotateLeft(node);
                    }
                    // Line: rotate the grandparent
                    setColor(parentOf(node), BLACK);
                    setColor(grandparentOf(node), RED);
                    rotateRight(grandparentOf(node));
                }
            } else {
                // Mirror image: parent is the RIGHT child
                Node uncle = leftOf(grandparentOf(node));

                if (isRed(uncle)) { // Recolor
                    setColor(parentOf(node), BLACK);
                    setColor(uncle, BLACK);
                    setColor(grandparentOf(node), RED);
                    node = grandparentOf(node);
                } else {
                    if (node == leftOf(parentOf(node))) { // Zig-zag
                        node = parentOf(node);
                        rotateRight(node);
                    }
                    // Line
                    setColor(parentOf(node), BLACK);
                    setColor(grandparentOf(node), RED);
                    rotateLeft(grandparentOf(node));
                }
            }
        }
        root.color = BLACK; // Rule 2: the root is always BLACK
    }

    /**
     * <h3>Left Rotation</h3>
     *
     * <pre>
     *      P            R
     *     / \          / \
     *    a   R   ==>  P   c
     *       / \      / \
     *      b   c    a   b
     * </pre>
     */
    private void rotateLeft(Node p) {
        Node r = p.right;
        if (r == null) {
            throw new IllegalStateException("left rotation at " + p.price + " without a right child");
        }
        p.right = r.left;
        if (r.left != null)
            r.left.parent = p;
        r.parent = p.parent;
        if (p.parent == null)
            root = r;
        else if (p.parent.left == p)
            p.parent.left = r;
        else if (p.parent.right == p)
            p.parent.right = r;
        else
            throw new IllegalStateException("node " + p.price + " is not a child of its parent " + p.parent.price);
        r.left = p;
        p.parent = r;
    }

    /**
     * <h3>Right Rotation</h3>
     * The mirror of Left Rotation. Pulls the Left child UP.
     */
    private void rotateRight(Node p) {
        Node l = p.left;
        if (l == null) {
            throw new IllegalStateException("right rotation at " + p.price + " without a left child");
        }
        p.left = l.right;
        if (l.right != null)
            l.right.parent = p;
        l.parent = p.parent;
        if (p.parent == null)
            root = l;
        else if (p.parent.right == p)
            p.parent.right = l;
        else if (p.parent.left == p)
            p.parent.left = l;
        else
            throw new IllegalStateException("node " + p.price + " is not a child of its parent " + p.parent.price);
        l.right = p;
        p.parent = l;
    }

    // =========================================================================
    // DELETION
    // =========================================================================

    private void deleteNode(Node node) {
        // Two children: swap places with the in-order successor so that 'node'
        // ends up with at most one child.
        if (node.left != null && node.right != null) {
            swapWithSuccessor(node, minimum(node.right));
        }

        // Now 'node' has at most one child to take its place
        Node replacement = (node.left != null ? node.left : node.right);

        if (replacement != null) {
            replacement.parent = node.parent;
            if (node.parent == null)
                root = replacement;
            else if (node == node.parent.left)
                node.parent.left = replacement;
            else
                node.parent.right = replacement;

            node.left = node.right = node.parent = null;

            // Removing a BLACK node leaves its path one BLACK short.
            if (node.color == BLACK)
                rebalanceAfterDeletion(replacement);

        } else if (node.parent == null) {
            root = null;
        } else {
            // Leaf: fix up while it is still linked, then cut it off.
            if (node.color == BLACK)
                rebalanceAfterDeletion(node);

            if (node.parent != null) {
                if (node == node.parent.left)
                    node.parent.left = null;
                else if (node == node.parent.right)
                    node.parent.right = null;
                node.parent = null;
            }
        }
    }

    /**
     * Restores the black height after a BLACK node left the path through {@code x}.
     */
    private void rebalanceAfterDeletion(Node x) {
        while (x != root && isBlack(x)) {
            if (x == leftOf(parentOf(x))) {
                Node sib = rightOf(parentOf(x));

                // RED sibling: rotate it up so the sibling becomes BLACK
                if (isRed(sib)) {
                    setColor(sib, BLACK);
                    setColor(parentOf(x), RED);
                    rotateLeft(parentOf(x));
                    sib = rightOf(parentOf(x));
                }

                if (isBlack(leftOf(sib)) && isBlack(rightOf(sib))) {
                    // BLACK nephews: paint the sibling RED, push the deficit up
                    setColor(sib, RED);
                    x = parentOf(x);
                } else {
                    // Near nephew RED: turn it into the far one
                    if (isBlack(rightOf(sib))) {
                        setColor(leftOf(sib), BLACK);
                        setColor(sib, RED);
                        rotateRight(sib);
                        sib = rightOf(parentOf(x));
                    }
                    setColor(sib, colorOf(parentOf(x)));
                    setColor(parentOf(x), BLACK);
                    // Far nephew RED: one rotation settles it
                    setColor(rightOf(sib), BLACK);
                    rotateLeft(parentOf(x));
                    x = root;
                }
            } else { // Symmetric
                Node sib = leftOf(parentOf(x));

                if (isRed(sib)) {
                    setColor(sib, BLACK);
                    setColor(parentOf(x), RED);
                    rotateRight(parentOf(x));
                    sib = leftOf(parentOf(x));
                }

                if (isBlack(rightOf(sib)) && isBlack(leftOf(sib))) {
                    setColor(sib, RED);
                    x = parentOf(x);
                } else {
                    if (isBlack(leftOf(sib))) {
                        setColor(rightOf(sib), BLACK);
                        setColor(sib, RED);
                        rotateLeft(sib);
                        sib = leftOf(parentOf(x));
                    }
                    setColor(sib, colorOf(parentOf(x)));
                    setColor(parentOf(x), BLACK);
                    setColor(leftOf(sib), BLACK);
                    rotateRight(parentOf(x));
                    x = root;
                }
            }
        }
        setColor(x, BLACK);
    }

    /**
     * Swaps two nodes in the tree topology, colors included. {@code y} is the
     * in-order successor of {@code x}, so it has no left child.
     */
    private void swapWithSuccessor(Node x, Node y) {
        Node xParent = x.parent;
        Node xLeft = x.left;
        Node xRight = x.right;
        boolean xColor = x.color;

        Node yParent = y.parent;
        Node yLeft = y.left;
        Node yRight = y.right;
        boolean yColor = y.color;

        boolean yIsChild = (y == xRight);

        // 1. Move Y into X's spot
        y.parent = xParent;
        if (xParent != null) {
            if (xParent.left == x)
                xParent.left = y;
            else
                xParent.right = y;
        } else {
            root = y;
        }
        y.left = xLeft;
        if (xLeft != null)
            xLeft.parent = y;

        if (yIsChild) {
            y.right = x;
        } else {
            y.right = xRight;
            if (xRight != null)
                xRight.parent = y;
        }
        y.color = xColor;

        // 2. Move X into Y's spot
        if (yIsChild) {
            x.parent = y;
        } else {
            x.parent = yParent;
            if (yParent != null) {
                if (yParent.left == y)
                    yParent.left = x;
                else
                    yParent.right = x;
            }
        }
        x.left = yLeft;
        if (yLeft != null)
            yLeft.parent = x;
        x.right = yRight;
        if (yRight != null)
            yRight.parent = x;
        x.color = yColor;
    }

    // --- Navigation ---

    private static Node minimum(Node node) {
        while (node.left != null)
            node = node.left;
        return node;
    }

    private static Node maximum(Node node) {
        while (node.right != null)
            node = node.right;
        return node;
    }

    private static Node successor(Node t) {
        if (t.right != null)
            return minimum(t.right);
        Node p = t.parent;
        Node ch = t;
        while (p != null && ch == p.right) {
            ch = p;
            p = p.parent;
        }
        return p;
    }

    private static Node predecessor(Node t) {
        if (t.left != null)
            return maximum(t.left);
        Node p = t.parent;
        Node ch = t;
        while (p != null && ch == p.left) {
            ch = p;
            p = p.parent;
        }
        return p;
    }

    // --- Null-safe helpers ---

    private static boolean isRed(Node p) {
        return p != null && p.color == RED;
    }

    private static boolean isBlack(Node p) {
        return p == null || p.color == BLACK;
    }

    private static boolean colorOf(Node p) {
        return p == null ? BLACK : p.color;
    }

    private static Node parentOf(Node p) {
        return p == null ? null : p.parent;
    }

    private static Node grandparentOf(Node p) {
        return (p != null && p.parent != null) ? p.parent.parent : null;
    }

    private static void setColor(Node p, boolean c) {
        if (p != null)
            p.color = c;
    }

    private static Node leftOf(Node p) {
        return p == null ? null : p.left;
    }

    private static Node rightOf(Node p) {
        return p == null ? null : p.right;
    }
}
