/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.jbellis.jroaring.container;

import static io.github.jbellis.jroaring.container.ContainerPolicy.BITMAP_WORDS;

/**
 * Pairwise set algebra between containers of any two representations.
 * <p>
 * Every result is built in freshly allocated storage and then moved to its best representation,
 * so operands are never modified or aliased.
 * <ul>
 * <li>array/array: merge of the sorted values</li>
 * <li>bitmap/bitmap: word-wise OR, AND, AND-NOT, XOR</li>
 * <li>run/run: interval arithmetic</li>
 * <li>array/bitmap: the array is walked and the bitmap probed, or the bitmap is copied and
 *     the array's bits set, cleared or flipped</li>
 * <li>run/bitmap: the runs are expanded to word masks</li>
 * <li>run/array: intersection probes the runs; the other operations turn the array into runs</li>
 * </ul>
 */
final class ContainerAlgebra {
    private ContainerAlgebra() {
    }

    static Container union(Container a, Container b) {
        switch (a.kind) {
            case ARRAY:
                switch (b.kind) {
                    case ARRAY:
                        return arrayUnion(a, b);
                    case BITMAP:
                        return bitmapArrayUnion(b, a);
                    case RUN:
                        return runUnion(a, b);
                    default:
                        throw Container.unknownKind(b.kind);
                }
            case BITMAP:
                switch (b.kind) {
                    case ARRAY:
                        return bitmapArrayUnion(a, b);
                    case BITMAP:
                        return wordwise(a.words, b.words, SetOp.OR);
                    case RUN:
                        return wordwise(a.words, b.toWords(), SetOp.OR);
                    default:
                        throw Container.unknownKind(b.kind);
                }
            case RUN:
                switch (b.kind) {
                    case ARRAY:
                    case RUN:
                        return runUnion(a, b);
                    case BITMAP:
                        return wordwise(a.toWords(), b.words, SetOp.OR);
                    default:
                        throw Container.unknownKind(b.kind);
                }
            default:
                throw Container.unknownKind(a.kind);
        }
    }

    static Container intersection(Container a, Container b) {
        switch (a.kind) {
            case ARRAY:
                switch (b.kind) {
                    case ARRAY:
                        return arrayIntersection(a, b);
                    case BITMAP:
                    case RUN:
                        return arrayFilter(a, b, true);
                    default:
                        throw Container.unknownKind(b.kind);
                }
            case BITMAP:
                switch (b.kind) {
                    case ARRAY:
                        return arrayFilter(b, a, true);
                    case BITMAP:
                        return wordwise(a.words, b.words, SetOp.AND);
                    case RUN:
                        return wordwise(a.words, b.toWords(), SetOp.AND);
                    default:
                        throw Container.unknownKind(b.kind);
                }
            case RUN:
                switch (b.kind) {
                    case ARRAY:
                        return arrayFilter(b, a, true);
                    case BITMAP:
                        return wordwise(a.toWords(), b.words, SetOp.AND);
                    case RUN:
                        return runIntersection(a, b);
                    default:
                        throw Container.unknownKind(b.kind);
                }
            default:
                throw Container.unknownKind(a.kind);
        }
    }

    static Container difference(Container a, Container b) {
        switch (a.kind) {
            case ARRAY:
                switch (b.kind) {
                    case ARRAY:
                        return arrayDifference(a, b);
                    case BITMAP:
                        return arrayFilter(a, b, false);
                    case RUN:
                        return runDifference(a, b);
                    default:
                        throw Container.unknownKind(b.kind);
                }
            case BITMAP:
                switch (b.kind) {
                    case ARRAY:
                        return bitmapArrayDifference(a, b);
                    case BITMAP:
                        return wordwise(a.words, b.words, SetOp.AND_NOT);
                    case RUN:
                        return bitmapRunDifference(a, b);
                    default:
                        throw Container.unknownKind(b.kind);
                }
            case RUN:
                switch (b.kind) {
                    case ARRAY:
                    case RUN:
                        return runDifference(a, b);
                    case BITMAP:
                        return wordwise(a.toWords(), b.words, SetOp.AND_NOT);
                    default:
                        throw Container.unknownKind(b.kind);
                }
            default:
                throw Container.unknownKind(a.kind);
        }
    }

    static Container symmetricDifference(Container a, Container b) {
        switch (a.kind) {
            case ARRAY:
                switch (b.kind) {
                    case ARRAY:
                        return arraySymmetricDifference(a, b);
                    case BITMAP:
                        return bitmapArrayXor(b, a);
                    case RUN:
                        return runSymmetricDifference(a, b);
                    default:
                        throw Container.unknownKind(b.kind);
                }
            case BITMAP:
                switch (b.kind) {
                    case ARRAY:
                        return bitmapArrayXor(a, b);
                    case BITMAP:
                        return wordwise(a.words, b.words, SetOp.XOR);
                    case RUN:
                        return wordwise(a.words, b.toWords(), SetOp.XOR);
                    default:
                        throw Container.unknownKind(b.kind);
                }
            case RUN:
                switch (b.kind) {
                    case ARRAY:
                    case RUN:
                        return runSymmetricDifference(a, b);
                    case BITMAP:
                        return wordwise(a.toWords(), b.words, SetOp.XOR);
                    default:
                        throw Container.unknownKind(b.kind);
                }
            default:
                throw Container.unknownKind(a.kind);
        }
    }

    private enum SetOp {
        OR, AND, AND_NOT, XOR
    }

    // array/array

    private static Container arrayUnion(Container a, Container b) {
        char[] x = a.content;
        char[] y = b.content;
        int nx = a.cardinality;
        int ny = b.cardinality;
        char[] out = new char[nx + ny];
        int i = 0, j = 0, k = 0;
        while (i < nx && j < ny) {
            char u = x[i];
            char v = y[j];
            if (u < v) {
                out[k++] = u;
                i++;
            } else if (v < u) {
                out[k++] = v;
                j++;
            } else {
                out[k++] = u;
                i++;
                j++;
            }
        }
        while (i < nx) {
            out[k++] = x[i++];
        }
        while (j < ny) {
            out[k++] = y[j++];
        }
        return Container.ofArray(out, k);
    }

    private static Container arrayIntersection(Container a, Container b) {
        char[] x = a.content;
        char[] y = b.content;
        int nx = a.cardinality;
        int ny = b.cardinality;
        char[] out = new char[Math.max(1, Math.min(nx, ny))];
        int i = 0, j = 0, k = 0;
        while (i < nx && j < ny) {
            char u = x[i];
            char v = y[j];
            if (u < v) {
                i++;
            } else if (v < u) {
                j++;
            } else {
                out[k++] = u;
                i++;
                j++;
            }
        }
        return Container.ofArray(out, k);
    }

    private static Container arrayDifference(Container a, Container b) {
        char[] x = a.content;
        char[] y = b.content;
        int nx = a.cardinality;
        int ny = b.cardinality;
        char[] out = new char[Math.max(1, nx)];
        int i = 0, j = 0, k = 0;
        while (i < nx && j < ny) {
            char u = x[i];
            char v = y[j];
            if (u < v) {
                out[k++] = u;
                i++;
            } else if (v < u) {
                j++;
            } else {
                i++;
                j++;
            }
        }
        while (i < nx) {
            out[k++] = x[i++];
        }
        return Container.ofArray(out, k);
    }

    private static Container arraySymmetricDifference(Container a, Container b) {
        char[] x = a.content;
        char[] y = b.content;
        int nx = a.cardinality;
        int ny = b.cardinality;
        char[] out = new char[Math.max(1, nx + ny)];
        int i = 0, j = 0, k = 0;
        while (i < nx && j < ny) {
            char u = x[i];
            char v = y[j];
            if (u < v) {
                out[k++] = u;
                i++;
            } else if (v < u) {
                out[k++] = v;
                j++;
            } else {
                i++;
                j++;
            }
        }
        while (i < nx) {
            out[k++] = x[i++];
        }
        while (j < ny) {
            out[k++] = y[j++];
        }
        return Container.ofArray(out, k);
    }

    // array against a probe-able container

    /**
     * Keeps the values of {@code array} that are (or, with {@code keep} false, are not) in {@code other}.
     */
    private static Container arrayFilter(Container array, Container other, boolean keep) {
        char[] out = new char[Math.max(1, array.cardinality)];
        int k = 0;
        for (int i = 0; i < array.cardinality; i++) {
            char v = array.content[i];
            if (other.contains(v) == keep) {
                out[k++] = v;
            }
        }
        return Container.ofArray(out, k);
    }

    // bitmap/array

    private static Container bitmapArrayUnion(Container bitmap, Container array) {
        long[] words = bitmap.words.clone();
        int cardinality = bitmap.cardinality;
        for (int i = 0; i < array.cardinality; i++) {
            char v = array.content[i];
            if (!BitmapOps.get(words, v)) {
                BitmapOps.set(words, v);
                cardinality++;
            }
        }
        return Container.ofWords(words, cardinality);
    }

    private static Container bitmapArrayDifference(Container bitmap, Container array) {
        long[] words = bitmap.words.clone();
        int cardinality = bitmap.cardinality;
        for (int i = 0; i < array.cardinality; i++) {
            char v = array.content[i];
            if (BitmapOps.get(words, v)) {
                BitmapOps.clear(words, v);
                cardinality--;
            }
        }
        return Container.ofWords(words, cardinality);
    }

    private static Container bitmapArrayXor(Container bitmap, Container array) {
        long[] words = bitmap.words.clone();
        int cardinality = bitmap.cardinality;
        for (int i = 0; i < array.cardinality; i++) {
            char v = array.content[i];
            if (BitmapOps.get(words, v)) {
                BitmapOps.clear(words, v);
                cardinality--;
            } else {
                BitmapOps.set(words, v);
                cardinality++;
            }
        }
        return Container.ofWords(words, cardinality);
    }

    // bitmap/run

    private static Container bitmapRunDifference(Container bitmap, Container run) {
        long[] words = bitmap.words.clone();
        for (int r = 0; r < run.runCount; r++) {
            int start = run.content[2 * r];
            BitmapOps.clearRange(words, start, start + run.content[2 * r + 1] + 1);
        }
        return Container.ofWords(words);
    }

    private static Container wordwise(long[] left, long[] right, SetOp op) {
        long[] out = new long[BITMAP_WORDS];
        int cardinality = 0;
        for (int i = 0; i < BITMAP_WORDS; i++) {
            long w;
            switch (op) {
                case OR:
                    w = left[i] | right[i];
                    break;
                case AND:
                    w = left[i] & right[i];
                    break;
                case AND_NOT:
                    w = left[i] & ~right[i];
                    break;
                case XOR:
                    w = left[i] ^ right[i];
                    break;
                default:
                    throw new IllegalArgumentException("Unknown operation " + op);
            }
            out[i] = w;
            cardinality += Long.bitCount(w);
        }
        return Container.ofWords(out, cardinality);
    }

    // run/run, with array operands turned into runs first

    private static RunBuilder runsOf(Container c) {
        if (c.kind == ContainerKind.RUN) {
            return null;
        }
        RunBuilder builder = new RunBuilder(c.runCount);
        c.forEachRun(builder);
        return builder;
    }

    private static char[] pairs(Container c, RunBuilder converted) {
        return converted == null ? c.content : converted.pairs();
    }

    private static Container runUnion(Container a, Container b) {
        char[] x = pairs(a, runsOf(a));
        char[] y = pairs(b, runsOf(b));
        return RunOps.union(x, a.runCount, y, b.runCount).build();
    }

    private static Container runIntersection(Container a, Container b) {
        return RunOps.intersection(a.content, a.runCount, b.content, b.runCount).build();
    }

    private static Container runDifference(Container a, Container b) {
        char[] x = pairs(a, runsOf(a));
        char[] y = pairs(b, runsOf(b));
        return RunOps.difference(x, a.runCount, y, b.runCount).build();
    }

    private static Container runSymmetricDifference(Container a, Container b) {
        char[] x = pairs(a, runsOf(a));
        char[] y = pairs(b, runsOf(b));
        RunBuilder union = RunOps.union(x, a.runCount, y, b.runCount);
        RunBuilder common = RunOps.intersection(x, a.runCount, y, b.runCount);
        return RunOps.difference(union.pairs(), union.runCount(), common.pairs(), common.runCount()).build();
    }
}
