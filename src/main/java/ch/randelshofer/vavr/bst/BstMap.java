/* ____  ______________  ________________________  __________
 * \   \/   /      \   \/   /   __/   /      \   \/   /      \
 *  \______/___/\___\______/___/_____/___/\___\______/___/\___\
 *
 * The MIT License (MIT)
 *
 * Copyright 2024 Vavr, https://vavr.io
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package ch.randelshofer.vavr.bst;

import io.vavr.Tuple;
import io.vavr.Tuple2;
import io.vavr.collection.List;
import io.vavr.control.Option;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collector;

/**
 * Implements a mutable map using an unbalanced binary search tree.
 * <p>
 * Features:
 * <ul>
 *     <li>keys are ordered by their natural order, or by a {@link Comparator}</li>
 *     <li>does not allow null keys, allows null values</li>
 *     <li>is mutable</li>
 *     <li>is not thread-safe</li>
 *     <li>iterates in ascending key order</li>
 *     <li>does not support removal of entries</li>
 * </ul>
 * <p>
 * Performance characteristics:
 * <ul>
 *     <li>put: O(h)</li>
 *     <li>apply, get, getOrElse, containsKey: O(h)</li>
 *     <li>size: O(1)</li>
 *     <li>iterator creation: O(h)</li>
 *     <li>iterator.next(): O(1) amortized</li>
 * </ul>
 * where h is the height of the tree.
 * <p>
 * Implementation details:
 * <p>
 * The tree is never rebalanced. Its shape depends only on the order in which
 * keys were first inserted: random insertion orders yield a height of
 * O(log N) on average, sorted insertion orders degenerate the tree into a
 * list of height N. All operations descend the tree with loops and an
 * explicit stack, so a degenerate tree costs time but cannot overflow the
 * call stack.
 * <p>
 * Each node is owned by exactly one parent. A node is created as a leaf when
 * its key is inserted for the first time, and stays at its position for the
 * lifetime of the map. Inserting an existing key overwrites the value of its
 * node in place.
 * <p>
 * The iterators returned by this map are fail-fast: if a new key is inserted
 * after an iterator has been created, the iterator throws a
 * {@link java.util.ConcurrentModificationException} on its next call to
 * {@code next()}. Fail-fast behavior is a debugging aid, and can not be relied
 * on when the map is accessed from multiple threads without synchronization.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class BstMap<K, V> implements Iterable<Tuple2<K, V>> {
    private final Comparator<? super K> comparator;
    BstNode<K, V> root;
    private int size;
    /**
     * The number of structural modifications, that is, of nodes linked into the tree.
     */
    int modCount;

    private BstMap(Comparator<? super K> comparator) {
        this.comparator = comparator;
    }

    /**
     * Returns a {@link Collector} which may be used in conjunction with
     * {@link java.util.stream.Stream#collect(Collector)} to obtain a {@link BstMap}.
     * Entries are inserted in encounter order.
     *
     * @param <K> The key type
     * @param <V> The value type
     * @return A {@link BstMap} Collector.
     */
    public static <K extends Comparable<? super K>, V> Collector<Tuple2<K, V>, BstMap<K, V>, BstMap<K, V>> collector() {
        return Collector.of(
                () -> BstMap.<K, V>empty(),
                (map, entry) -> map.put(entry._1, entry._2),
                (left, right) -> {
                    left.putAll(right);
                    return left;
                });
    }

    /**
     * Returns a new empty map, which orders its keys by their natural order.
     *
     * @param <K> The key type
     * @param <V> The value type
     * @return A new empty map
     */
    public static <K extends Comparable<? super K>, V> BstMap<K, V> empty() {
        return new BstMap<>(Comparator.<K>naturalOrder());
    }

    /**
     * Returns a new empty map, which orders its keys with the given comparator.
     *
     * @param comparator The comparator that orders the keys
     * @param <K>        The key type
     * @param <V>        The value type
     * @return A new empty map
     */
    public static <K, V> BstMap<K, V> empty(Comparator<? super K> comparator) {
        Objects.requireNonNull(comparator, "comparator is null");
        return new BstMap<>(comparator);
    }

    /**
     * Returns a new map, which contains the given entry.
     *
     * @param key   A key
     * @param value The value for the key
     * @param <K>   The key type
     * @param <V>   The value type
     * @return A new map containing the given entry
     */
    public static <K extends Comparable<? super K>, V> BstMap<K, V> of(K key, V value) {
        BstMap<K, V> map = empty();
        map.put(key, value);
        return map;
    }

    /**
     * Creates a BstMap of the given list of key-value pairs. The pairs are
     * inserted from left to right.
     *
     * @param k1  a key for the map
     * @param v1  the value for k1
     * @param k2  a key for the map
     * @param v2  the value for k2
     * @param <K> The key type
     * @param <V> The value type
     * @return A new map containing the given entries
     */
    public static <K extends Comparable<? super K>, V> BstMap<K, V> of(K k1, V v1, K k2, V v2) {
        BstMap<K, V> map = of(k1, v1);
        map.put(k2, v2);
        return map;
    }

    /**
     * Creates a BstMap of the given list of key-value pairs. The pairs are
     * inserted from left to right.
     *
     * @param k1  a key for the map
     * @param v1  the value for k1
     * @param k2  a key for the map
     * @param v2  the value for k2
     * @param k3  a key for the map
     * @param v3  the value for k3
     * @param <K> The key type
     * @param <V> The value type
     * @return A new map containing the given entries
     */
    public static <K extends Comparable<? super K>, V> BstMap<K, V> of(K k1, V v1, K k2, V v2, K k3, V v3) {
        BstMap<K, V> map = of(k1, v1, k2, v2);
        map.put(k3, v3);
        return map;
    }

    /**
     * Returns a BstMap that contains the entries of the given {@link java.util.Map}.
     * The entries are inserted in the iteration order of the given map.
     *
     * @param map A map
     * @param <K> The key type
     * @param <V> The value type
     * @return A new map containing the entries of the given map
     */
    public static <K extends Comparable<? super K>, V> BstMap<K, V> ofAll(Map<? extends K, ? extends V> map) {
        Objects.requireNonNull(map, "map is null");
        BstMap<K, V> result = empty();
        result.putAllEntries(map.entrySet());
        return result;
    }

    /**
     * Creates a BstMap of the given entries. The entries are inserted in the
     * given order; if a key occurs more than once, its last value wins.
     *
     * @param entries Map entries
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new map containing the given entries
     */
    @SafeVarargs
    @SuppressWarnings("varargs")
    public static <K extends Comparable<? super K>, V> BstMap<K, V> ofEntries(Tuple2<? extends K, ? extends V>... entries) {
        Objects.requireNonNull(entries, "entries is null");
        return BstMap.<K, V>ofEntries(Arrays.asList(entries));
    }

    /**
     * Creates a BstMap of the given entries. The entries are inserted in
     * iteration order; if a key occurs more than once, its last value wins.
     *
     * @param entries Map entries
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new map containing the given entries
     */
    public static <K extends Comparable<? super K>, V> BstMap<K, V> ofEntries(Iterable<? extends Tuple2<? extends K, ? extends V>> entries) {
        return ofEntries(Comparator.<K>naturalOrder(), entries);
    }

    /**
     * Creates a BstMap of the given entries, which orders its keys with the
     * given comparator.
     *
     * @param comparator The comparator that orders the keys
     * @param entries    Map entries
     * @param <K>        The key type
     * @param <V>        The value type
     * @return A new map containing the given entries
     */
    public static <K, V> BstMap<K, V> ofEntries(Comparator<? super K> comparator, Iterable<? extends Tuple2<? extends K, ? extends V>> entries) {
        Objects.requireNonNull(entries, "entries is null");
        BstMap<K, V> map = empty(comparator);
        map.putAll(entries);
        return map;
    }

    /**
     * Associates the given value with the given key.
     * <p>
     * If the map already contains the key, the value of its node is replaced,
     * and the size of the map does not change. Otherwise, a new leaf is linked
     * into the tree.
     *
     * @param key   a key, must not be null
     * @param value a value, may be null
     * @throws NullPointerException if the key is null
     * @throws ClassCastException   if the key can not be compared with the keys in the map
     */
    public void put(K key, V value) {
        Objects.requireNonNull(key, "key is null");
        if (root == null) {
            root = new BstNode<>(key, value);
            size = 1;
            modCount++;
            return;
        }
        BstNode<K, V> parent = root;
        while (true) {
            int cmp = comparator.compare(key, parent.key);
            if (cmp == 0) {
                parent.value = value;
                return;
            }
            BstNode<K, V> child = cmp < 0 ? parent.left : parent.right;
            if (child == null) {
                BstNode<K, V> leaf = new BstNode<>(key, value);
                if (cmp < 0) {
                    parent.left = leaf;
                } else {
                    parent.right = leaf;
                }
                size++;
                modCount++;
                return;
            }
            parent = child;
        }
    }

    /**
     * Puts all given entries into this map, in iteration order.
     *
     * @param entries map entries
     */
    public void putAll(Iterable<? extends Tuple2<? extends K, ? extends V>> entries) {
        Objects.requireNonNull(entries, "entries is null");
        if (entries == this) {
            return;
        }
        for (Tuple2<? extends K, ? extends V> e : entries) {
            put(e._1, e._2);
        }
    }

    /**
     * Puts all given {@link Map.Entry entries} into this map, in iteration order.
     *
     * @param entries map entries
     */
    public void putAllEntries(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
        Objects.requireNonNull(entries, "entries is null");
        for (Map.Entry<? extends K, ? extends V> e : entries) {
            put(e.getKey(), e.getValue());
        }
    }

    /**
     * Returns the value associated with the given key.
     *
     * @param key a key
     * @return the value of the key
     * @throws KeyNotFoundException if this map does not contain the key
     * @throws ClassCastException   if the key can not be compared with the keys in the map
     */
    public V apply(K key) {
        BstNode<K, V> node = findNode(key);
        if (node == null) {
            throw new KeyNotFoundException(key);
        }
        return node.value;
    }

    /**
     * Returns the value associated with the given key, wrapped in an
     * {@link Option}.
     *
     * @param key a key
     * @return {@code Some(value)} if this map contains the key, {@code None} otherwise
     */
    public Option<V> get(K key) {
        BstNode<K, V> node = findNode(key);
        return node == null ? Option.none() : Option.some(node.value);
    }

    /**
     * Returns the value associated with the given key, or the given default
     * value if this map does not contain the key.
     *
     * @param key          a key
     * @param defaultValue the value to return if the key is absent
     * @return the value of the key, or {@code defaultValue}
     */
    public V getOrElse(K key, V defaultValue) {
        BstNode<K, V> node = findNode(key);
        return node == null ? defaultValue : node.value;
    }

    /**
     * Returns true if this map contains the given key.
     *
     * @param key a key
     * @return true if the key is present
     */
    public boolean containsKey(K key) {
        return findNode(key) != null;
    }

    /**
     * Descends from the root to the node with the given key.
     * Null keys are never stored, so they are never found.
     */
    private BstNode<K, V> findNode(K key) {
        if (key == null) {
            return null;
        }
        BstNode<K, V> node = root;
        while (node != null) {
            int cmp = comparator.compare(key, node.key);
            if (cmp == 0) {
                return node;
            }
            node = cmp < 0 ? node.left : node.right;
        }
        return null;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Returns the comparator that orders the keys of this map.
     *
     * @return the comparator
     */
    public Comparator<? super K> comparator() {
        return comparator;
    }

    /**
     * Returns an iterator over the entries of this map in ascending key order.
     * Each call starts a new traversal of the current state of the tree.
     *
     * @return an entry iterator
     */
    @Override
    public io.vavr.collection.Iterator<Tuple2<K, V>> iterator() {
        return new BstIterator<K, V, Tuple2<K, V>>(this, node -> Tuple.of(node.key, node.value));
    }

    /**
     * Returns an iterator over the keys of this map in ascending order.
     * Each call starts a new traversal of the current state of the tree.
     *
     * @return a key iterator
     */
    public io.vavr.collection.Iterator<K> keysIterator() {
        return new BstIterator<>(this, BstNode::getKey);
    }

    /**
     * Returns an iterator over the values of this map, in ascending order of
     * their keys.
     *
     * @return a value iterator
     */
    public io.vavr.collection.Iterator<V> valuesIterator() {
        return new BstIterator<>(this, BstNode::getValue);
    }

    /**
     * Returns the keys of this map in ascending order.
     *
     * @return a list of the keys
     */
    public List<K> keys() {
        return List.ofAll(keysIterator());
    }

    /**
     * Returns a copy of this map as a {@link TreeMap} with the same key order.
     *
     * @return a new {@link TreeMap}
     */
    public TreeMap<K, V> toJavaMap() {
        TreeMap<K, V> result = new TreeMap<>(comparator);
        for (Tuple2<K, V> e : this) {
            result.put(e._1, e._2);
        }
        return result;
    }

    /**
     * Returns the entries of this map in the form {@code {k1: v1, k2: v2}},
     * in ascending key order. Text is quoted, so that {@code 3} and
     * {@code '3'} can be told apart.
     */
    @Override
    public String toString() {
        return iterator()
                .map(e -> Repr.of(e._1) + ": " + Repr.of(e._2))
                .mkString("{", ", ", "}");
    }
}
