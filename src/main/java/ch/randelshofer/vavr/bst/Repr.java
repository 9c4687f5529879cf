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

import java.util.Collection;
import java.util.Map;

/**
 * Renders objects in a form that tells text apart from other values.
 * <p>
 * Character sequences and characters are quoted and escaped, so that the
 * string {@code "3"} renders as {@code '3'} while the integer {@code 3}
 * renders as {@code 3}. Single quotes are used, unless the text contains a
 * single quote and no double quote. Control characters are escaped.
 * <p>
 * Elements of a {@link Collection} render as {@code [e1, e2]}, and entries of
 * a {@link Map} as {@code {k1: v1, k2: v2}}, each element in this form.
 * Any other object renders with {@link String#valueOf(Object)}.
 */
final class Repr {
    private Repr() {
    }

    static String of(Object o) {
        if (o instanceof CharSequence) {
            return quote((CharSequence) o);
        }
        if (o instanceof Character) {
            return quote(o.toString());
        }
        if (o instanceof Collection) {
            StringBuilder b = new StringBuilder("[");
            for (Object e : (Collection<?>) o) {
                if (b.length() > 1) {
                    b.append(", ");
                }
                b.append(of(e));
            }
            return b.append(']').toString();
        }
        if (o instanceof Map) {
            StringBuilder b = new StringBuilder("{");
            for (Map.Entry<?, ?> e : ((Map<?, ?>) o).entrySet()) {
                if (b.length() > 1) {
                    b.append(", ");
                }
                b.append(of(e.getKey())).append(": ").append(of(e.getValue()));
            }
            return b.append('}').toString();
        }
        return String.valueOf(o);
    }

    static String quote(CharSequence s) {
        char q = '\'';
        if (contains(s, '\'') && !contains(s, '"')) {
            q = '"';
        }
        StringBuilder b = new StringBuilder(s.length() + 2);
        b.append(q);
        for (int i = 0, n = s.length(); i < n; i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\':
                    b.append("\\\\");
                    break;
                case '\n':
                    b.append("\\n");
                    break;
                case '\r':
                    b.append("\\r");
                    break;
                case '\t':
                    b.append("\\t");
                    break;
                default:
                    if (c == q) {
                        b.append('\\').append(c);
                    } else if (Character.isISOControl(c)) {
                        b.append(String.format("\\x%02x", (int) c));
                    } else {
                        b.append(c);
                    }
            }
        }
        return b.append(q).toString();
    }

    private static boolean contains(CharSequence s, char c) {
        for (int i = 0, n = s.length(); i < n; i++) {
            if (s.charAt(i) == c) {
                return true;
            }
        }
        return false;
    }
}
