/*
 * ExprDebugStrings.java
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

import javax.annotation.Nonnull;

/**
 * Unambiguous s-expression rendering used by {@link Expr#toString()} in logs and test failures.
 */
final class ExprDebugStrings {
    private ExprDebugStrings() {
    }

    @Nonnull
    static String toDebugString(@Nonnull Expr e) {
        final StringBuilder sb = new StringBuilder();
        append(sb, e);
        return sb.toString();
    }

    private static void append(@Nonnull StringBuilder sb, @Nonnull Expr e) {
        switch (e.getKind()) {
            case VAR:
                sb.append('#').append(((Var)e).getIndex());
                break;
            case SORT:
                sb.append("Sort(").append(((Sort)e).getLevel()).append(')');
                break;
            case CONSTANT: {
                final Constant constant = (Constant)e;
                sb.append(constant.getName());
                if (!constant.getLevels().isEmpty()) {
                    sb.append(".{").append(constant.getLevels()).append('}');
                }
                break;
            }
            case META:
                sb.append('?').append(((MetaVar)e).getDisplayName());
                break;
            case LOCAL:
                sb.append(((Local)e).getPpName());
                break;
            case APP:
                sb.append('(');
                append(sb, ((App)e).getFn());
                sb.append(' ');
                append(sb, ((App)e).getArg());
                sb.append(')');
                break;
            case LAMBDA:
            case PI: {
                final Binding binding = (Binding)e;
                sb.append(binding.isLambda() ? "(fun " : "(Pi ").append(binding.getName())
                        .append(" : ");
                append(sb, binding.getDomain());
                sb.append(", ");
                append(sb, binding.getBody());
                sb.append(')');
                break;
            }
            default: {
                final Macro macro = (Macro)e;
                sb.append('[').append(macro.getDefinition().getName());
                for (Expr arg : macro.getArgs()) {
                    sb.append(' ');
                    append(sb, arg);
                }
                sb.append(']');
                break;
            }
        }
    }
}
