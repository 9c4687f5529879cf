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

import java.util.ArrayDeque;
import java.util.ConcurrentModificationException;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Iterates over the nodes of a {@link BstMap} in ascending key order, and
 * maps every node to an element.
 * <p>
 * The iterator keeps a stack with the nodes whose left subtree has been
 * visited but which have not been returned yet. The top of the stack is
 * always the next node in key order. Descending to the leftmost node of a
 * subtree is deferred until the subtree is reached, so creating an iterator
 * costs O(height), and abandoning it early costs nothing.
 * <p>
 * The iterator fails fast if a key is added to the map after the iterator
 * has been created. Updating the value of an existing key does not change
 * the shape of the tree and is tolerated.
 *
 * @param <K> the key type
 * @param <V> the value type
 * @param <E> the element type
 */
final class BstIterator<K, V, E> implements io.vavr.collection.Iterator<E> {
    private final BstMap<K, V> map;
    private final Function<BstNode<K, V>, E> mappingFunction;
    private final ArrayDeque<BstNode<K, V>> stack = new ArrayDeque<>();
    private final int expectedModCount;

    BstIterator(BstMap<K, V> map, Function<BstNode<K, V>, E> mappingFunction) {
        this.map = map;
        this.mappingFunction = mappingFunction;
        this.expectedModCount = map.modCount;
        pushLeftSpine(map.root);
    }

    private void pushLeftSpine(BstNode<K, V> node) {
        for (BstNode<K, V> n = node; n != null; n = n.left) {
            stack.push(n);
        }
    }

    @Override
    public boolean hasNext() {
        return !stack.isEmpty();
    }

    @Override
    public E next() {
        if (map.modCount != expectedModCount) {
            throw new ConcurrentModificationException();
        }
        if (stack.isEmpty()) {
            throw new NoSuchElementException("next() on empty iterator");
        }
        BstNode<K, V> node = stack.pop();
        pushLeftSpine(node.right);
        return mappingFunction.apply(node);
    }
}
