package com.cliffc.proof.print;

import com.cliffc.proof.*;
import com.cliffc.proof.term.Id;
import com.cliffc.proof.term.Term;
import com.cliffc.proof.util.Ary;
import com.cliffc.proof.util.SB;

import java.util.List;

/** Graphviz output: one HTML-table node per proof node, one edge per
 *  parent-child link, plus a root node showing the initial sequent. */
public abstract class Dot {

  // Escape for an HTML-like label
  public static SB box( SB sb, String s ) {
    for( int i=0; i<s.length(); i++ ) {
      char c = s.charAt(i);
      switch( c ) {
      case '&': sb.p("&amp;"); break;
      case '<': sb.p("&lt;");  break;
      case '>': sb.p("&gt;");  break;
      case '"': sb.p("&quot;");break;
      default:  sb.p(c);
      }
    }
    return sb;
  }
  public static SB id( SB sb, Id id ) { return box(sb,id._name); }
  public static SB term( SB sb, Term t ) { return box(sb,t.toString()); }

  private static SB table( SB sb, String color ) {
    return sb.p("[shape=plaintext, label=<<TABLE BORDER=\"0\" CELLBORDER=\"1\" CELLSPACING=\"0\" BGCOLOR=\"").p(color).p("\">");
  }
  private static SB end_table( SB sb ) { return sb.p("</TABLE>>];").nl(); }

  private static SB hyp( SB sb, Id id ) {
    return term(id(sb.p("<TD>"),id).p("</TD><TD>"),id._ty).p("</TD>");
  }

  private static SB sequent( SB sb, String s, String color, Sequent seq ) {
    term(sb.p("<TR><TD BGCOLOR=\"YELLOW\" colspan=\"3\">"),seq._goal).p("</TD></TR>");
    List<Id> hyps = seq._env.bindings();
    if( hyps.isEmpty() )
      return sb.p("<TR><TD BGCOLOR=\"").p(color).p("\" colspan=\"3\">").p(s).p("</TD></TR>");
    sb.p("<TR><TD BGCOLOR=\"").p(color).p("\" rowspan=\"").p(hyps.size()).p("\">").p(s).p("</TD>");
    hyp(sb,hyps.get(0)).p("</TR>");
    for( int i=1; i<hyps.size(); i++ )
      hyp(sb.p("<TR>"),hyps.get(i)).p("</TR>");
    return sb;
  }

  private static SB root( SB sb, Sequent seq ) {
    table(sb.p("root "),"LIGHTBLUE");
    return end_table(sequent(sb,"ROOT","PURPLE",seq));
  }

  public static SB proof( SB sb, Proof p ) {
    sb.p("digraph proof {").ii(1).nl();
    root(sb,p._root);
    Node r = p.root();
    sb.p("root -> node_").p(r._uid).p(';').nl();
    Ary<Node> work = new Ary<>();
    work.push(r);
    while( !work.isEmpty() ) {
      Node n = work.pop();
      table(sb.p("node_").p(n._uid).s(),"LIGHTBLUE");
      if( n.extract() instanceof Node.Closed<?> c ) {
        sb.p("<TR><TD>").p(c._step._name).p("</TD><TD>");
        c.print(Lang.Dot,sb).p("</TD></TR>");
        end_table(sb);
        for( int i=0; i<c.nbranches(); i++ )
          sb.p("node_").p(n._uid).p(" -> node_").p(c.branch(i)._uid).p(';').nl();
        for( int i=c.nbranches()-1; i>=0; i-- )
          work.push(c.branch(i));
      } else
        end_table(sequent(sb,"OPEN ("+n._uid+")","RED",n.sequent()));
    }
    return sb.di(1).unchar(2).p('}').nl();
  }

  public static SB proof_term( SB sb, Sequent seq, Term t ) {
    sb.p("digraph proof {").ii(1).nl();
    root(sb,seq);
    sb.p("root -> term;").nl();
    table(sb.p("term "),"LIGHTBLUE");
    term(sb.p("<TR><TD>"),t).p("</TD></TR>");
    return end_table(sb).di(1).unchar(2).p('}').nl();
  }
}
