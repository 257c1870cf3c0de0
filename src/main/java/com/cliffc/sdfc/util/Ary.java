package com.cliffc.sdfc.util;

import java.lang.reflect.Array;
import java.util.*;
import java.util.function.Function;
import java.util.function.Predicate;

// ArrayList with saner syntax
@SuppressWarnings("unchecked")
public class Ary<E> implements Iterable<E> {
  public E[] _es;
  public int _len;
  public Ary(E[] es) { this(es,es.length); }
  public Ary(E[] es, int len) { _es=es; _len=len; }
  public Ary(Class<E> clazz) { this((E[]) Array.newInstance(clazz, 1),0); }

  /** @return list is empty */
  public boolean isEmpty() { return _len==0; }
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
    return _es[--_len];
  }

  /** Add element in amortized constant time
   *  @param e Element to add at end of list
   *  @return 'this' for flow-coding */
  public Ary<E> add( E e ) {
    if( _len >= _es.length ) _es = Arrays.copyOf(_es,Math.max(1,_es.length<<1));
    _es[_len++] = e;
    return this;
  }

  /** Linear-time insert.  Preserves order.
   *  @param i index to insert at; 0 inserts at the head, _len appends
   *  @param e Element to insert */
  public Ary<E> insert( int i, E e ) {
    if( i < 0 || i > _len ) throw new ArrayIndexOutOfBoundsException(""+i+" > "+_len);
    if( _len >= _es.length ) _es = Arrays.copyOf(_es,Math.max(1,_es.length<<1));
    System.arraycopy(_es,i,_es,i+1,_len-i);
    _es[i] = e;
    _len++;
    return this;
  }

  public E set( int i, E e ) {
    range_check(i);
    return (_es[i] = e);
  }

  /** @param c Collection to be added */
  public Ary<E> addAll( Collection<? extends E> c ) { for( E e : c ) add(e); return this; }

  /** @param c Collection to be added */
  public Ary<E> addAll( Ary<? extends E> c ) {
    if( c._len==0 ) return this;
    while( _len+c._len > _es.length ) _es = Arrays.copyOf(_es,Math.max(1,_es.length<<1));
    System.arraycopy(c._es,0,_es,_len,c._len);
    _len += c._len;
    return this;
  }

  /** @return a shallow copy, sharing elements but not the backing array */
  public Ary<E> copy() { return new Ary<>(Arrays.copyOf(_es,Math.max(1,_len)),_len); }

  /** @return a new list with the elements in reverse order */
  public Ary<E> reverse() {
    Ary<E> rev = new Ary<>(Arrays.copyOf(_es,Math.max(1,_len)),_len);
    for( int i=0, j=_len-1; i<j; i++, j-- ) { E tmp = rev._es[i]; rev._es[i] = rev._es[j]; rev._es[j] = tmp; }
    return rev;
  }

  /** @return compact array version, using the internal base array where possible. */
  public E[] asAry() { return _len==_es.length ? _es : Arrays.copyOf(_es,_len); }

  /** @param f function to apply to each element.
   *  @return a new list of the mapped elements */
  public <F> Ary<F> map( Function<E,F> f, Class<F> clazz ) {
    Ary<F> fs = new Ary<>(clazz);
    for( int i=0; i<_len; i++ ) fs.add(f.apply(_es[i]));
    return fs;
  }
  /** Find the first element matching predicate P, or -1 if none.
   *  @param P Predicate to match
   *  @return index of first matching element, or -1 if none */
  public int find( Predicate<E> P ) {
    for( int i=0; i<_len; i++ )  if( P.test(_es[i]) )  return i;
    return -1;
  }
  /** @return index of the element, by reference equality, or -1 */
  public int find( E e ) {
    for( int i=0; i<_len; i++ )  if( _es[i]==e )  return i;
    return -1;
  }
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

  // Element-wise equals, over the active length only
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof Ary<?> ary) || _len != ary._len ) return false;
    for( int i=0; i<_len; i++ )
      if( !Objects.equals(_es[i],ary._es[i]) )
        return false;
    return true;
  }
  @Override public int hashCode() {
    int h = _len;
    for( int i=0; i<_len; i++ ) h = h*31 + Objects.hashCode(_es[i]);
    return h;
  }

  private void range_check( int i ) {
    if( i < 0 || i>=_len )
      throw new ArrayIndexOutOfBoundsException(""+i+" >= "+_len);
  }

}
