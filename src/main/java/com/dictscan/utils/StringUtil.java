package com.dictscan.utils;

import org.apache.commons.lang3.StringUtils;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

public class StringUtil {
  public static final int MAX_DISPLAY_CHARS = 40;
  private static Gson gson = null;

  public static synchronized Gson getGsonInstance() {
    if (gson == null) gson = makeGsonInstance();
    return gson;
  }

  /**
   * Quotes {@code s} for log output, abbreviating it past
   * {@link #MAX_DISPLAY_CHARS}.
   */
  public static String toDisplayString(CharSequence s) {
    if (s == null) return "null";
    return "\"" + StringUtils.abbreviate(s.toString(), MAX_DISPLAY_CHARS) + "\"";
  }

  public static String toJson(Object o) {
    return getGsonInstance().toJson(o);
  }

  private static Gson makeGsonInstance() {
    return new GsonBuilder().disableHtmlEscaping()
                            .create();
  }
}
