package com.cliffc.demangle.util;

import java.lang.reflect.Array;
import java.util.*;

// ArrayList with saner syntax.  Order is always preserved; child lists depend on it.
public class Ary<E> implements Iterable<E> {
  public E[] _es;
  public int _len;
  public Ary(E[] es, int len) { _es=es; _len=len; }
  @SuppressWarnings("unchecked")
  public Ary(Class<E> clazz) { this((E[]) Array.newInstance(clazz, 1),0); }

  /** @return list is empty */
  public boolean isEmpty() { return _len==0; }
  /** @return active list length */
  public int len() { return _len; }
  /** @param i element index
   *  @return element being returned, or null if OOB */
  public E atX( int i ) {
    return 0 <= i && i < _len ? _es[i] : null;
  }
  /** @return last element */
  public E last( ) {
    range_check(0);
    return _es[_len-1];
  }

  /** Add element in amortized constant time
   *  @param e Element to add at end of list
   *  @return 'this' for flow-coding */
  public Ary<E> add( E e ) {
    if( _len >= _es.length ) _es = Arrays.copyOf(_es,Math.max(1,_es.length<<1));
    _es[_len++] = e;
    return this;
  }

  /** Slow, linear-time, element removal.  Preserves order.
   *  @param i element to be removed
   *  @return element removed */
  public E remove( int i ) {
    range_check(i);
    E e = _es[i];
    System.arraycopy(_es,i+1,_es,i,(--_len)-i);
    _es[_len] = null;
    return e;
  }

  public E set( int i, E e ) {
    range_check(i);
    return (_es[i] = e);
  }

  /** Reverse elements [from,len) in place; the prefix is untouched.
   *  @param from first index of the reversed suffix */
  public Ary<E> reverse( int from ) {
    for( int lo=from, hi=_len-1; lo<hi; lo++, hi-- ) {
      E tmp = _es[lo]; _es[lo] = _es[hi]; _es[hi] = tmp;
    }
    return this;
  }

  /** Find by identity
   *  @return index of e, or -1 if none */
  public int find( E e ) {
    for( int i=0; i<_len; i++ )  if( _es[i]==e )  return i;
    return -1;
  }

  /** @return a fresh, independent copy of the active elements */
  public List<E> asList() { return new ArrayList<>(Arrays.asList(_es).subList(0,_len)); }

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
      if( _es[i] != null ) sb.p(_es[i].toString());
    }
    return sb.p('}').toString();
  }

  private void range_check( int i ) {
    if( i < 0 || i>=_len )
      throw new ArrayIndexOutOfBoundsException(""+i+" >= "+_len);
  }
}
