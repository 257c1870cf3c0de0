package com.cliffc.sdfc;

import com.cliffc.sdfc.sched.Refine;

import java.util.Properties;

/** Compiler switches.  Immutable; build from properties with {@link #from}.
 *  <ul>
 *  <li>{@code sdfc.mem_alloc}: merge branches normalized as value references,
 *      for memory allocation downstream.  Default false.</li>
 *  <li>{@code sdfc.schedule}: {@code cluster} or {@code topological}.
 *      Default {@code cluster}.</li>
 *  <li>{@code sdfc.stop_on_first_error}: stop a program at the first failing
 *      node.  Default false.</li>
 *  </ul>
 */
public final class Options {
  public static final Options DEFAULT = new Options(false,Refine.CLOCK_CLUSTER,false);

  public final boolean _mem_alloc;
  public final Refine _refine;
  public final boolean _stop_on_first_error;

  public Options( boolean mem_alloc, Refine refine, boolean stop_on_first_error ) {
    _mem_alloc=mem_alloc; _refine=refine; _stop_on_first_error=stop_on_first_error;
  }

  public static Options from( Properties props ) {
    boolean mem  = Boolean.parseBoolean(props.getProperty("sdfc.mem_alloc","false"));
    boolean stop = Boolean.parseBoolean(props.getProperty("sdfc.stop_on_first_error","false"));
    String sched = props.getProperty("sdfc.schedule","cluster").trim();
    Refine refine = switch( sched ) {
    case "cluster" -> Refine.CLOCK_CLUSTER;
    case "topological" -> Refine.TOPOLOGICAL;
    default -> throw new IllegalArgumentException("sdfc.schedule: expected cluster or topological, found '"+sched+"'");
    };
    return new Options(mem,refine,stop);
  }
  public static Options fromSystem() { return from(System.getProperties()); }

  public Options with_mem_alloc( boolean b ) { return new Options(b,_refine,_stop_on_first_error); }
  public Options with_refine( Refine r ) { return new Options(_mem_alloc,r,_stop_on_first_error); }
  public Options with_stop_on_first_error( boolean b ) { return new Options(_mem_alloc,_refine,b); }

  @Override public String toString() {
    return "mem_alloc="+_mem_alloc+" schedule="+_refine+" stop_on_first_error="+_stop_on_first_error;
  }
}
