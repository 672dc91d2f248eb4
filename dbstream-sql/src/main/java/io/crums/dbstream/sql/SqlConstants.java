/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream.sql;


import java.lang.System.Logger;

/**
 * Module constants.
 */
public class SqlConstants {

  // no one calls
  private SqlConstants() {  }


  public final static String LOG_NAME = "io.crums.dbstream.sql";


  static Logger getLogger() {
    return System.getLogger(LOG_NAME);
  }

}
