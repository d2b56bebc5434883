/* 
 * Copyright (C) 2026 LAPTrack developers
 *
 * This File is part of LAPTrack
 *
 * LAPTrack is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * LAPTrack is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with LAPTrack.  If not, see <http://www.gnu.org/licenses/>.
 */
package laptrack.utils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.function.Function;

public class HashMapGetCreate<K, V> extends HashMap<K, V> {
    final Function<K, V> factory;
    public HashMapGetCreate(Function<K, V> factory) {
        super();
        this.factory=factory;
    }

    public V getAndCreateIfNecessary(Object key) {
        V v = super.get(key);
        if (v==null) {
            v = factory.apply((K)key);
            super.put((K)key, v);
        }
        return v;
    }

    public static class ListFactory<K, V> implements Function<K, List<V>>{
        @Override public List<V> apply(K key) {
            return new ArrayList<>();
        }
    }
}
