package com.cliffc.proof.env;

import com.cliffc.proof.PF;
import com.cliffc.proof.term.Id;
import com.cliffc.proof.term.Term;
import com.cliffc.proof.util.SB;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/** Proof environment: the identifiers available inside a sequent.
 *
 *  Bindings map a formula (the type of an identifier) to the identifier
 *  standing for its proof.  Locals come from intros and cuts, globals from
 *  declarations, and hidden bindings are recorded but never displayed nor
 *  looked up.  A reverse index from names keeps every name unique, and a
 *  per-prefix counter makes fresh names cheap.
 *
 *  Environments are values: every extension returns a new Env and leaves the
 *  receiver untouched, so sibling proof branches can diverge from a shared
 *  ancestor.
 */
public final class Env {
  private static final Logger LOGGER = LogManager.getLogger();

  public final Coercions _coercions;     // Lookup fallbacks; shared by a whole family of envs
  private final HashMap<Term,Id> _names;  // Local bindings
  private final HashMap<Term,Id> _global; // Global bindings
  private final HashMap<Term,Id> _hidden; // Hidden bindings
  private final HashMap<String,Id> _reverse;    // Every bound name
  private final HashMap<String,Integer> _count; // Next suffix to try, per prefix

  private Env( Coercions coercions, HashMap<Term,Id> names, HashMap<Term,Id> global, HashMap<Term,Id> hidden,
               HashMap<String,Id> reverse, HashMap<String,Integer> count ) {
    _coercions = coercions;
    _names = names; _global = global; _hidden = hidden;
    _reverse = reverse; _count = count;
  }

  public static Env empty( Coercions coercions ) {
    return new Env(coercions,new HashMap<>(),new HashMap<>(),new HashMap<>(),new HashMap<>(),new HashMap<>());
  }

  // Copy-on-write
  private static <K,V> HashMap<K,V> put( HashMap<K,V> map, K k, V v ) {
    HashMap<K,V> map2 = new HashMap<>(map);
    map2.put(k,v);
    return map2;
  }

  /** @return true if the identifier's name is bound, hidden or not */
  public boolean exists( Id id ) { return _reverse.containsKey(id._name); }
  public boolean exists( String name ) { return _reverse.containsKey(name); }

  /** @return true if some local or global identifier stands for the formula */
  public boolean mem( Term f ) { return _names.containsKey(f) || _global.containsKey(f); }

  /** @return the identifier for the formula, locals first, or null */
  public @Nullable Id get( Term f ) {
    Id id = _names.get(f);
    return id==null ? _global.get(f) : id;
  }

  /** Lookup through the coercions, in order.
   *  @return a term whose type is exactly 'f'
   *  @throws NotIntroduced if no coercion finds a binding */
  public Term find( Term f ) {
    for( Coercions.Coercion c : _coercions )
      for( Coercions.Coerced cand : c.apply(f) ) {
        Id id = get(cand._term);
        if( id==null ) continue;
        Term res = cand._wrap.apply(id.term());
        if( res.ty().equals(f) ) return res;
        LOGGER.debug("Originally looking for {} coerced to {} which found {} but wrapped into {}",f,cand._term,id,res);
        throw PF.fatal("Coercion '"+c._name+"' returned a wrongly wrapped term.");
      }
    throw new NotIntroduced(f);
  }

  /** Bind 'id' locally, as the proof of its type.
   *  @throws NameConflict if the name is already bound */
  public Env add( Id id ) {
    Id old = _reverse.get(id._name);
    if( old!=null ) throw new NameConflict(id,old);
    return new Env(_coercions,put(_names,id._ty,id),_global,_hidden,put(_reverse,id._name,id),_count);
  }

  /** Bind a declared constant globally.
   *  @throws NameConflict if the name is already bound */
  public Env declare( Id id ) {
    if( id.is_var() ) throw PF.fatal("Declaring a plain variable: "+id);
    LOGGER.debug("Declaring {} : {}",id,id._ty);
    Id old = _reverse.get(id._name);
    if( old!=null ) throw new NameConflict(id,old);
    return new Env(_coercions,_names,put(_global,id._ty,id),_hidden,put(_reverse,id._name,id),_count);
  }

  // A freshly minted identifier, and the env it lives in
  public static final class Intro {
    public final Id _id;
    public final Env _env;
    Intro( Id id, Env env ) { _id = id; _env = env; }
  }

  public Intro intro( String prefix, Term f ) { return intro(prefix,f,false); }

  /** Mint a fresh 'prefix<N>' of type 'f'.  Always succeeds: names are
   *  unbounded and the reverse index is finite. */
  public Intro intro( String prefix, Term f, boolean hide ) {
    int n = local_count(prefix);
    while( _reverse.containsKey(prefix+n) ) n++;
    Id id = Id.var(prefix+n,f);
    HashMap<String,Integer> count = put(_count,prefix,n+1);
    HashMap<String,Id> reverse = put(_reverse,id._name,id);
    Env e = hide
      ? new Env(_coercions,_names,_global,put(_hidden,f,id),reverse,count)
      : new Env(_coercions,put(_names,f,id),_global,_hidden,reverse,count);
    return new Intro(id,e);
  }

  private int local_count( String prefix ) {
    Integer n = _count.get(prefix);
    return n==null ? 0 : n;
  }

  /** @return number of visible (local and global) bindings */
  public int count() { return _names.size() + _global.size(); }

  /** @return locals sorted by name, then globals sorted by name */
  public List<Id> bindings() {
    List<Id> l = new ArrayList<>(_names.values());
    l.sort(null);
    List<Id> g = new ArrayList<>(_global.values());
    g.sort(null);
    l.addAll(g);
    return l;
  }

  public SB str( SB sb ) {
    for( Id id : bindings() )
      id.str(sb).nl();
    return sb;
  }
  @Override public String toString() { return str(new SB()).toString(); }
}
