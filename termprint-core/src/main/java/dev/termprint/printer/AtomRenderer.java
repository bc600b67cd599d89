/*
 * AtomRenderer.java
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
import dev.termprint.term.Annotations;
import dev.termprint.term.Constant;
import dev.termprint.term.Expr;
import dev.termprint.term.Level;
import dev.termprint.term.Local;
import dev.termprint.term.Macro;
import dev.termprint.term.MetaVar;
import dev.termprint.term.Name;
import dev.termprint.term.Numerals;
import dev.termprint.term.Sort;
import dev.termprint.term.Var;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Renders the leaves of a term (variables, sorts, constants, metavariables, locals, numerals) and macros.
 */
final class AtomRenderer {
    @Nonnull
    private final TermRenderer renderer;
    @Nonnull
    private final LevelPrinter levelPrinter;

    AtomRenderer(@Nonnull TermRenderer renderer) {
        this.renderer = renderer;
        this.levelPrinter = new LevelPrinter(renderer.getIndent());
    }

    @Nonnull
    RenderResult renderVar(@Nonnull Expr e) {
        return RenderResult.of(Format.text("#" + ((Var)e).getIndex()));
    }

    @Nonnull
    RenderResult renderSort(@Nonnull Expr e) {
        final Level level = ((Sort)e).getLevel();
        if (renderer.getEnvironment().isImpredicative() && level.isZero()) {
            return RenderResult.of(Format.text("Prop"));
        }
        if (renderer.getConfiguration().isShowUniverses()) {
            return RenderResult.of(Format.group(Format.compose(Format.text("Type.{"),
                    Format.nest(6, levelPrinter.print(level)), Format.text("}"))));
        }
        return RenderResult.of(Format.text("Type"));
    }

    @Nonnull
    RenderResult renderConstant(@Nonnull Expr e) {
        final Constant constant = (Constant)e;
        final Name name = displayName(constant.getName());
        if (renderer.getConfiguration().isShowUniverses() && !constant.getLevels().isEmpty()) {
            final List<Format> parts = new ArrayList<>();
            parts.add(Format.text(name + ".{"));
            boolean first = true;
            for (Level level : constant.getLevels()) {
                final Format levelFormat = level.isMax() || level.isImax()
                                           ? Format.paren(levelPrinter.print(level))
                                           : levelPrinter.print(level);
                parts.add(Format.nest(renderer.getIndent(),
                        first ? levelFormat : Format.compose(Format.line(), levelFormat)));
                first = false;
            }
            parts.add(Format.text("}"));
            return RenderResult.of(Format.group(Format.compose(parts)));
        }
        return RenderResult.of(Format.text(name.toString()));
    }

    /**
     * The name a constant is shown with: its alias or its name relative to an open namespace unless full names are
     * requested, then the user name of a private constant unless private names are requested.
     * @param fullName the constant name
     * @return the displayed name
     */
    @Nonnull
    Name displayName(@Nonnull Name fullName) {
        Name name = fullName;
        if (!renderer.getConfiguration().isFullNames()) {
            final Optional<Name> alias = getVisibleAlias(name);
            if (alias.isPresent()) {
                name = alias.get();
            } else {
                for (Name namespace : renderer.getEnvironment().getOpenNamespaces()) {
                    if (!namespace.isAnonymous()) {
                        final Name relative = name.replacePrefix(namespace, Name.ANONYMOUS);
                        if (!relative.equals(name) && !relative.isAnonymous()) {
                            name = relative;
                            break;
                        }
                    }
                }
            }
        }
        if (!renderer.getConfiguration().isPrivateNames()) {
            final Optional<Name> userName = renderer.getEnvironment().getUserName(name);
            if (userName.isPresent()) {
                name = userName.get();
            }
        }
        return name;
    }

    @Nonnull
    private Optional<Name> getVisibleAlias(@Nonnull Name name) {
        final Optional<Name> alias = renderer.getEnvironment().getAlias(name);
        if (alias.isEmpty()) {
            return alias;
        }
        for (Name namespace : renderer.getEnvironment().getOpenNamespaces()) {
            if (!namespace.isAnonymous() && renderer.getEnvironment().contains(namespace.append(alias.get()))) {
                return Optional.empty();
            }
        }
        return alias;
    }

    @Nonnull
    RenderResult renderMeta(@Nonnull Expr e) {
        return RenderResult.of(Format.text("?" + ((MetaVar)e).getDisplayName()));
    }

    @Nonnull
    RenderResult renderLocal(@Nonnull Expr e) {
        return RenderResult.of(Format.text(((Local)e).getPpName().toString()));
    }

    @Nonnull
    RenderResult renderNumeral(@Nonnull Expr e) {
        return RenderResult.of(Format.text(Numerals.toNumber(e).orElseThrow().toString()));
    }

    @Nonnull
    RenderResult renderMacro(@Nonnull Expr e) {
        if (Annotations.isExplicit(e)) {
            final RenderResult arg = renderer.renderChild(Annotations.getExplicitArg(e), RenderResult.MAX_BP);
            return RenderResult.of(RenderResult.MAX_BP,
                    Format.compose(renderer.getGlyphs().explicit(), arg.getFormat()));
        }
        final Macro macro = (Macro)e;
        final List<Format> parts = new ArrayList<>();
        parts.add(Format.text("[" + macro.getDefinition().getName()));
        for (Expr arg : macro.getArgs()) {
            parts.add(Format.nest(renderer.getIndent(), Format.compose(Format.line(),
                    renderer.renderChildFormat(arg, RenderResult.MAX_BP))));
        }
        parts.add(Format.text("]"));
        return RenderResult.of(Format.group(Format.compose(parts)));
    }
}
