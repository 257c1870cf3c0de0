package com.cliffc.sdfc;

import com.cliffc.sdfc.util.Ary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/** Receiver of user-facing diagnostics.  Passes report a diagnostic before
 *  throwing the matching {@link CompileError}.
 */
public interface Reporter {
  void report( ErrMsg err );

  // Drops everything
  Reporter NONE = err -> { };

  // Keeps every diagnostic in discovery order, and logs it
  class Collect implements Reporter {
    private static final Logger LOG = LogManager.getLogger();
    public final Ary<ErrMsg> _errs = new Ary<>(ErrMsg.class);
    @Override public synchronized void report( ErrMsg err ) {
      err._order = _errs._len;
      _errs.add(err);
      LOG.error(err.toString());
    }
    public boolean has_errors() { return !_errs.isEmpty(); }
    // Sorted by level, then discovery order
    public Ary<ErrMsg> sorted() {
      ErrMsg[] errs = _errs.asAry().clone();
      Arrays.sort(errs);
      return new Ary<>(errs);
    }
  }
}
