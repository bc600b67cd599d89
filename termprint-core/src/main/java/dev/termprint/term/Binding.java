/*
 * Binding.java
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

package dev.termprint.term;

import dev.termprint.annotation.API;
import com.google.common.base.Preconditions;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A lambda abstraction or a dependent product. The body refers to the bound variable as {@code #0}.
 */
@API(API.Status.EXPERIMENTAL)
public final class Binding extends Expr {
    @Nonnull
    private final ExprKind kind;
    @Nonnull
    private final Name name;
    @Nonnull
    private final Expr domain;
    @Nonnull
    private final Expr body;
    @Nonnull
    private final BinderInfo binderInfo;

    public Binding(@Nonnull ExprKind kind, @Nonnull Name name, @Nonnull Expr domain, @Nonnull Expr body,
                   @Nonnull BinderInfo binderInfo) {
        super(Math.max(domain.getLooseBVarRange(), Math.max(body.getLooseBVarRange() - 1, 0)),
                domain.hasExprMetavar() || body.hasExprMetavar(),
                domain.hasUnivMetavar() || body.hasUnivMetavar(),
                domain.hasLocal() || body.hasLocal(),
                ((kind.hashCode() * 31 + domain.hashCode()) * 31 + body.hashCode()) * 31 + binderInfo.hashCode());
        Preconditions.checkArgument(kind == ExprKind.LAMBDA || kind == ExprKind.PI, "binding must be a lambda or a pi");
        this.kind = kind;
        this.name = name;
        this.domain = domain;
        this.body = body;
        this.binderInfo = binderInfo;
    }

    @Override
    public ExprKind getKind() {
        return kind;
    }

    @Nonnull
    public Name getName() {
        return name;
    }

    @Nonnull
    public Expr getDomain() {
        return domain;
    }

    @Nonnull
    public Expr getBody() {
        return body;
    }

    @Nonnull
    public BinderInfo getBinderInfo() {
        return binderInfo;
    }

    @Nonnull
    public Binding update(@Nonnull Expr newDomain, @Nonnull Expr newBody) {
        return newDomain == domain && newBody == body ? this : new Binding(kind, name, newDomain, newBody, binderInfo);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Binding)) {
            return false;
        }
        final Binding other = (Binding)o;
        return hashCode() == other.hashCode()
                && kind == other.kind
                && binderInfo.equals(other.binderInfo)
                && domain.equals(other.domain)
                && body.equals(other.body);
    }
}
