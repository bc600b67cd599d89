/*
 * NamePurifier.java
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

import dev.termprint.annotation.API;
import dev.termprint.term.Constant;
import dev.termprint.term.Expr;
import dev.termprint.term.Exprs;
import dev.termprint.term.Level;
import dev.termprint.term.Local;
import dev.termprint.term.MetaVar;
import dev.termprint.term.Sort;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * Gives every metavariable and local constant of a term a display name that no other one purified in the same
 * {@link RenderContext} shares. Identities are kept, only display names change, so purifying twice is a no-op.
 * Level metavariables are renamed only when universes are shown.
 */
@API(API.Status.INTERNAL)
public final class NamePurifier {
    @Nonnull
    private final RenderContext context;
    private final boolean showUniverses;

    public NamePurifier(@Nonnull RenderContext context, boolean showUniverses) {
        this.context = context;
        this.showUniverses = showUniverses;
    }

    private boolean needsPurification(@Nonnull Expr e) {
        return e.hasExprMetavar() || e.hasLocal() || (showUniverses && e.hasUnivMetavar());
    }

    @Nonnull
    public Expr purify(@Nonnull Expr e) {
        if (!needsPurification(e)) {
            return e;
        }
        return Exprs.replace(e, (sub, offset) -> {
            if (!needsPurification(sub)) {
                return sub;
            }
            if (sub instanceof MetaVar) {
                final MetaVar meta = (MetaVar)sub;
                return meta.withDisplayName(context.getMetavarName(meta.getId()));
            }
            if (sub instanceof Local) {
                final Local local = (Local)sub;
                return local.withPpName(context.getLocalName(local.getId(), local.getPpName()));
            }
            if (sub instanceof Constant) {
                final Constant constant = (Constant)sub;
                final List<Level> levels = new ArrayList<>(constant.getLevels().size());
                for (Level level : constant.getLevels()) {
                    levels.add(purify(level));
                }
                return constant.withLevels(levels);
            }
            if (sub instanceof Sort) {
                return ((Sort)sub).withLevel(purify(((Sort)sub).getLevel()));
            }
            return null;
        });
    }

    @Nonnull
    public Level purify(@Nonnull Level l) {
        if (!showUniverses || !l.hasMeta()) {
            return l;
        }
        return l.replace(sub -> {
            if (!sub.hasMeta()) {
                return sub;
            }
            if (sub.isMeta()) {
                return sub.withDisplayName(context.getMetavarName(sub.getName()));
            }
            return null;
        });
    }
}
