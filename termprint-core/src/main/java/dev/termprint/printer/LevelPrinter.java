/*
 * LevelPrinter.java
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

package dev.termprint.printer;

import dev.termprint.format.Format;
import dev.termprint.term.Level;

import javax.annotation.Nonnull;

/**
 * Formats universe levels: {@code 0}, numerals for closed successor chains, {@code l+k} offsets,
 * {@code max l1 l2} and {@code imax l1 l2}, parameters, {@code ?M_1} metavariables and {@code _} placeholders.
 */
final class LevelPrinter {
    private final int indent;

    LevelPrinter(int indent) {
        this.indent = indent;
    }

    @Nonnull
    Format print(@Nonnull Level l) {
        switch (l.getKind()) {
            case ZERO:
                return Format.text("0");
            case SUCC: {
                int k = 0;
                Level base = l;
                while (base.isSucc()) {
                    base = base.getLhs();
                    k++;
                }
                if (base.isZero()) {
                    return Format.text(Integer.toString(k));
                }
                return Format.compose(printChild(base), Format.text("+" + k));
            }
            case MAX:
            case IMAX: {
                final String keyword = l.isMax() ? "max" : "imax";
                return Format.group(Format.compose(Format.text(keyword),
                        Format.nest(indent, Format.compose(
                                Format.line(), printChild(l.getLhs()),
                                Format.line(), printChild(l.getRhs())))));
            }
            case PARAM:
                return Format.text(l.getName().toString());
            case META:
                return Format.text("?" + l.getDisplayName());
            default:
                return Format.text("_");
        }
    }

    /**
     * A level as an argument: compound levels are parenthesized.
     * @param l the level
     * @return its format
     */
    @Nonnull
    Format printChild(@Nonnull Level l) {
        final Format format = print(l);
        return isCompound(l) ? Format.paren(format) : format;
    }

    static boolean isCompound(@Nonnull Level l) {
        if (l.isMax() || l.isImax()) {
            return true;
        }
        if (l.isSucc()) {
            Level base = l;
            while (base.isSucc()) {
                base = base.getLhs();
            }
            return !base.isZero();
        }
        return false;
    }
}
