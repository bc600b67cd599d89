/*
 * FormatLayout.java
 *
 * This source file is part of the TermPrint open source project
 *
 * Copyright 2024-2026 the TermPrint project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.termprint.format;

import dev.termprint.annotation.API;
import com.google.common.base.Preconditions;

import javax.annotation.Nonnull;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Greedy page-width layout of a {@link Format}. A group is laid out flat when its content, together with what
 * follows it up to the next line break, fits in the remaining width; otherwise its lines become newlines indented
 * by the enclosing nesting. The root is laid out as a group.
 */
@API(API.Status.EXPERIMENTAL)
public final class FormatLayout {
    private FormatLayout() {
    }

    private static final class Item {
        private final int indent;
        private final boolean flat;
        @Nonnull
        private final Format format;

        Item(int indent, boolean flat, @Nonnull Format format) {
            this.indent = indent;
            this.flat = flat;
            this.format = format;
        }
    }

    /**
     * Lay out a format.
     * @param format the format
     * @param width the page width
     * @return the text
     */
    @Nonnull
    public static String render(@Nonnull Format format, int width) {
        Preconditions.checkArgument(width > 0, "width must be positive");
        final StringBuilder sb = new StringBuilder();
        final Deque<Item> stack = new ArrayDeque<>();
        stack.push(new Item(0, false, Format.group(format)));
        int column = 0;
        while (!stack.isEmpty()) {
            final Item item = stack.pop();
            final Format f = item.format;
            switch (f.getKind()) {
                case TEXT:
                    sb.append(f.getText());
                    column += f.getText().length();
                    break;
                case LINE:
                    if (item.flat) {
                        sb.append(' ');
                        column++;
                    } else {
                        sb.append('\n');
                        for (int i = 0; i < item.indent; i++) {
                            sb.append(' ');
                        }
                        column = item.indent;
                    }
                    break;
                case NEST:
                    stack.push(new Item(item.indent + f.getIndent(), item.flat, f.getChild()));
                    break;
                case COMPOSE:
                    pushAll(stack, item.indent, item.flat, f.getChildren());
                    break;
                case GROUP:
                    if (item.flat) {
                        stack.push(new Item(item.indent, true, f.getChild()));
                    } else {
                        final Item flatItem = new Item(item.indent, true, f.getChild());
                        stack.push(new Item(item.indent, fits(width - column, flatItem, stack), f.getChild()));
                    }
                    break;
                default:
                    stack.push(new Item(item.indent, item.flat, f.getChild()));
                    break;
            }
        }
        return sb.toString();
    }

    private static void pushAll(@Nonnull Deque<Item> stack, int indent, boolean flat, @Nonnull List<Format> children) {
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(new Item(indent, flat, children.get(i)));
        }
    }

    private static boolean fits(int remaining, @Nonnull Item first, @Nonnull Deque<Item> rest) {
        final Deque<Item> work = new ArrayDeque<>();
        work.push(first);
        final Iterator<Item> restIterator = rest.iterator();
        int left = remaining;
        while (left >= 0) {
            final Item item;
            if (!work.isEmpty()) {
                item = work.pop();
            } else if (restIterator.hasNext()) {
                item = restIterator.next();
            } else {
                return true;
            }
            final Format f = item.format;
            switch (f.getKind()) {
                case TEXT:
                    left -= f.getText().length();
                    break;
                case LINE:
                    if (!item.flat) {
                        return true;
                    }
                    left--;
                    break;
                case COMPOSE:
                    pushAll(work, item.indent, item.flat, f.getChildren());
                    break;
                case NEST:
                    work.push(new Item(item.indent + f.getIndent(), item.flat, f.getChild()));
                    break;
                default:
                    work.push(new Item(item.indent, item.flat, f.getChild()));
                    break;
            }
        }
        return false;
    }
}
