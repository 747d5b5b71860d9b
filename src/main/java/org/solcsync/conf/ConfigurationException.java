/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.conf;

public class ConfigurationException extends Exception {

  public ConfigurationException() {}

  public ConfigurationException(String msg) {
    super(msg);
  }

  public ConfigurationException(String msg, Exception ex) {
    super(msg, ex);
  }

}
