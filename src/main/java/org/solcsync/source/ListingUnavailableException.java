/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.source;

/**
 * Thrown if a version source cannot produce any artifact sequence at all,
 * which aborts the run before any transfer starts.
 */
public class ListingUnavailableException extends Exception {

  public ListingUnavailableException(String msg) {
    super(msg);
  }

  public ListingUnavailableException(String msg, Exception ex) {
    super(msg, ex);
  }

}
