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

import java.util.Collection;
import java.util.Iterator;
import java.util.function.Function;

public class Utils {

    public static String toStringArray(double[] array) {
        return toStringArray(array, "[", "]", "; ", n -> String.format(java.util.Locale.US, "%.4g", n.doubleValue())).toString();
    }

    public static StringBuilder toStringArray(double[] array, String init, String end, String sep, Function<Number, String> numberFormatter) {
        StringBuilder sb = new StringBuilder(init);
        if (array.length==0) {
            sb.append(end);
            return sb;
        }
        for (int i = 0; i<array.length-1; ++i) {
            sb.append(numberFormatter.apply(array[i]));
            sb.append(sep);
        }
        sb.append(numberFormatter.apply(array[array.length-1]));
        sb.append(end);
        return sb;
    }

    public static <T> String toStringList(Collection<T> list, Function<T, Object> toString) {
        return toStringList(list, "[", "]", ";", toString).toString();
    }

    public static <T> StringBuilder toStringList(Collection<T> list, String init, String end, String sep, Function<T, Object> toString) {
        StringBuilder sb = new StringBuilder(init);
        if (list.isEmpty()) {
            sb.append(end);
            return sb;
        }
        Iterator<T> it = list.iterator();
        while(it.hasNext()) {
            T t = it.next();
            String s=null;
            if (t!=null) {
                Object o = toString.apply(t);
                if (o!=null) s = o.toString();
            }
            if (s==null) s = "NA";
            sb.append(s);
            sb.append(it.hasNext() ? sep : end);
        }
        return sb;
    }

}
