/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;


import java.lang.System.Logger;

/**
 * Module constants.
 */
public class DbStreamConstants {

  // no one calls
  private DbStreamConstants() {  }


  public final static String LOG_NAME = "io.crums.dbstream";


  static Logger getLogger() {
    return System.getLogger(LOG_NAME);
  }

}
