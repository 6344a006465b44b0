// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package wyhoare.util;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

public class Util {

    /**
     * Map a given list of elements from one kind to another.
     *
     * @param items
     * @param fn
     * @param <T>
     * @return
     */
    public static <S,T> List<T> map(List<S> items, Function<S,T> fn) {
        ArrayList<T> rs = new ArrayList<>();
        for(int i=0;i!=items.size();++i) {
            rs.add(fn.apply(items.get(i)));
        }
        return rs;
    }

    /**
     * Functional list append.  This creates a fresh list containing both <code>left</code> and <code>right</code> operands.
     * @param left
     * @param right
     * @param <T>
     * @return
     */
    public static <T> List<T> append(List<T> left, T right) {
        ArrayList<T> result = new ArrayList<>();
        result.addAll(left);
        result.add(right);
        return result;
    }

    /**
     * Functional list append.  This creates a fresh list containing both <code>left</code> and <code>right</code> operands.
     * @param left
     * @param right
     * @param <T>
     * @return
     */
    public static <T> List<T> append(List<T> left, List<T> right) {
        ArrayList<T> result = new ArrayList<>();
        result.addAll(left);
        result.addAll(right);
        return result;
    }

    /**
     * Euclidean division, where the remainder is always non-negative. The
     * divisor must be non-zero.
     *
     * @param lhs
     * @param rhs
     * @return
     */
    public static BigInteger div(BigInteger lhs, BigInteger rhs) {
        BigInteger[] qr = lhs.divideAndRemainder(rhs);
        if (qr[1].signum() < 0) {
            // Adjust so remainder lands in [0,|rhs|)
            return rhs.signum() > 0 ? qr[0].subtract(BigInteger.ONE) : qr[0].add(BigInteger.ONE);
        }
        return qr[0];
    }

    /**
     * Euclidean remainder, which is always within <code>[0,|rhs|)</code>.
     *
     * @param lhs
     * @param rhs
     * @return
     */
    public static BigInteger rem(BigInteger lhs, BigInteger rhs) {
        return lhs.mod(rhs.abs());
    }

    /**
     * Largest integer not above <code>lhs / rhs</code>, for positive
     * <code>rhs</code>.
     */
    public static BigInteger floorDiv(BigInteger lhs, BigInteger rhs) {
        BigInteger[] qr = lhs.divideAndRemainder(rhs);
        return qr[1].signum() < 0 ? qr[0].subtract(BigInteger.ONE) : qr[0];
    }
}
