package com.cliffc.proof.env;

import com.cliffc.proof.util.Ary;
import com.cliffc.proof.term.Term;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Iterator;
import java.util.List;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/** Ordered, append-only list of lookup coercions.
 *
 *  Some terms have equivalent forms that are annoying to distinguish, for
 *  instance {@code a = b} and {@code b = a}.  When a lookup for a term fails,
 *  a coercion may suggest other terms to look for, each with a wrapper that
 *  turns a proof of the suggested term back into a proof of the requested one.
 *
 *  Plain lookup is the trivial coercion, always registered first so the
 *  common case never pays for the others.  Coercions are tried in
 *  registration order and never removed.
 */
public final class Coercions implements Iterable<Coercions.Coercion> {
  private static final Logger LOGGER = LogManager.getLogger();

  public static final String IDENTITY = "<id>";

  // A candidate term to look up, and how to adapt what it finds
  public static final class Coerced {
    public final Term _term;
    public final UnaryOperator<Term> _wrap;
    public Coerced( Term term, UnaryOperator<Term> wrap ) { _term = term; _wrap = wrap; }
  }

  public static final class Coercion {
    public final String _name;
    final Function<Term,List<Coerced>> _fn;
    Coercion( String name, Function<Term,List<Coerced>> fn ) { _name = name; _fn = fn; }
    public List<Coerced> apply( Term t ) { return _fn.apply(t); }
    @Override public String toString() { return _name; }
  }

  private final Ary<Coercion> _cs = new Ary<>();

  public Coercions() { register(IDENTITY, t -> List.of(new Coerced(t,x -> x))); }

  public Coercions register( String name, Function<Term,List<Coerced>> fn ) {
    LOGGER.debug("Registering coercion '{}'",name);
    _cs.push(new Coercion(name,fn));
    return this;
  }

  public int len() { return _cs._len; }
  public Coercion at( int i ) { return _cs.at(i); }
  @Override public Iterator<Coercion> iterator() { return _cs.iterator(); }
}
