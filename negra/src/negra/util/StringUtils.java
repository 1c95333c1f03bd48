package negra.util;

import java.util.*;

public class StringUtils {

  public static String join(Collection<String> s, String delimiter) {
    if (s.isEmpty()) return "";
    Iterator<String> iter = s.iterator();
    StringBuffer buffer = new StringBuffer(iter.next());
    while (iter.hasNext()) {
      buffer.append(delimiter);
      buffer.append(iter.next());
    }
    return buffer.toString();
  }

  /** splits a comma separated option value, dropping empty items */
  public static List<String> splitList(String s) {
    List<String> items = new ArrayList<String>();
    for (String item : s.split(",")) {
      item = item.trim();
      if (!item.isEmpty())
        items.add(item);
    }
    return items;
  }

  /** <code>true</code> for null, the empty string and the Negra placeholder <code>--</code> */
  public static boolean isBlank(String s) {
    return s == null || s.isEmpty() || s.equals("--");
  }
}
