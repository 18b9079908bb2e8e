package com.cliffc.proof.util;

import java.util.*;
import java.util.function.Predicate;

// ArrayList with saner syntax
@SuppressWarnings("unchecked")
public class Ary<E> implements Iterable<E> {
  // Really an Object[]; never hand it out typed
  private E[] _es = (E[])new Object[2];
  public int _len;

  /** @return list is empty */
  public boolean isEmpty() { return _len==0; }
  /** @return active list length */
  public int len() { return _len; }
  /** @param i element index
   *  @return element being returned; throws if OOB */
  public E at( int i ) {
    range_check(i);
    return _es[i];
  }
  /** @return last element */
  public E last( ) {
    range_check(0);
    return _es[_len-1];
  }

  /** @return remove and return last element */
  public E pop( ) {
    range_check(0);
    E e = _es[--_len];
    _es[_len] = null;           // No stale refs; popped items can be large trees
    return e;
  }

  /** Add element in amortized constant time
   *  @param e Element to add at end of list
   *  @return 'this' for flow-coding */
  public Ary<E> push( E e ) {
    if( _len >= _es.length ) _es = Arrays.copyOf(_es,Math.max(1,_es.length<<1));
    _es[_len++] = e;
    return this;
  }

  public E set( int i, E e ) {
    range_check(i);
    return (_es[i] = e);
  }

  /** @param c Collection to be added */
  public Ary<E> addAll( E[] c ) { for( E e : c ) push(e); return this; }

  /** Find the first element matching predicate P, or -1 if none.
   *  @param P Predicate to match
   *  @return index of first matching element, or -1 if none */
  public int find( Predicate<E> P ) {
    for( int i=0; i<_len; i++ )  if( P.test(_es[i]) )  return i;
    return -1;
  }
  /** @return index of the element, by equals(), or -1 */
  public int find( E e ) { return find(x -> Objects.equals(x,e)); }

  /** @return an iterator */
  @Override public Iterator<E> iterator() { return new Iter(); }
  private class Iter implements Iterator<E> {
    int _i=0;
    @Override public boolean hasNext() { return _i<_len; }
    @Override public E next() {
      if( _i>=_len ) throw new NoSuchElementException();
      return _es[_i++];
    }
  }

  @Override public String toString() {
    SB sb = new SB().p('{');
    for( int i=0; i<_len; i++ ) {
      if( i>0 ) sb.p(',');
      if( _es[i] != null ) sb.pobj(_es[i]);
    }
    return sb.p('}').toString();
  }

  private void range_check( int i ) {
    if( i < 0 || i>=_len )
      throw new ArrayIndexOutOfBoundsException(""+i+" >= "+_len);
  }
}
