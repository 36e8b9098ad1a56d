// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package vc2smt.io;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

import vc2smt.core.Logic;
import vc2smt.core.Logic.Expr;
import vc2smt.core.Logic.Type;
import vc2smt.tasks.SMTLibProverOptions;

/**
 * Converts monomorphic expressions into SMT-LIB2 text. Identifiers are obtained
 * from the session's namer. The output does not depend on the default locale.
 *
 * @author David J. Pearce
 *
 */
public class SMTLibExprLinearizer {
	private final SMTLibNamer namer;
	private final boolean useWeights;
	private final boolean useZ3;

	public SMTLibExprLinearizer(SMTLibNamer namer, boolean useWeights, boolean useZ3) {
		this.namer = namer;
		this.useWeights = useWeights;
		this.useZ3 = useZ3;
	}

	public static String toString(Expr expr, SMTLibNamer namer, SMTLibProverOptions options) {
		return new SMTLibExprLinearizer(namer, options.getUseWeights(), options.getUseZ3()).linearize(expr);
	}

	/**
	 * Convert a sort into SMT-LIB2 text.
	 *
	 * @param type
	 * @param namer
	 * @return
	 */
	public static String toString(Type type, SMTLibNamer namer) {
		if (type instanceof Type.Primitive) {
			return ((Type.Primitive) type).getName();
		} else if (type instanceof Type.BitVector) {
			return "(_ BitVec " + ((Type.BitVector) type).getWidth() + ")";
		} else if (type instanceof Type.Map) {
			Type.Map m = (Type.Map) type;
			return "(Array " + toString(m.getKey(), namer) + " " + toString(m.getValue(), namer) + ")";
		} else if (type instanceof Type.Constructor) {
			Type.Constructor c = (Type.Constructor) type;
			String name = namer.getName(c);
			if (c.getArguments().isEmpty()) {
				return name;
			}
			StringBuilder sb = new StringBuilder("(").append(name);
			for (Type arg : c.getArguments()) {
				sb.append(" ").append(toString(arg, namer));
			}
			return sb.append(")").toString();
		} else {
			throw new IllegalArgumentException("sort expected, found " + type);
		}
	}

	public String linearize(Expr expr) {
		StringBuilder out = new StringBuilder();
		writeExpr(out, expr);
		return out.toString();
	}

	private void writeExpr(StringBuilder out, Expr e) {
		if (e instanceof Expr.Boolean) {
			out.append(((Expr.Boolean) e).getValue() ? "true" : "false");
		} else if (e instanceof Expr.Integer) {
			writeInteger(out, (Expr.Integer) e);
		} else if (e instanceof Expr.Decimal) {
			writeDecimal(out, (Expr.Decimal) e);
		} else if (e instanceof Expr.BitVector) {
			writeBitVector(out, (Expr.BitVector) e);
		} else if (e instanceof Expr.StringLiteral) {
			String s = ((Expr.StringLiteral) e).getValue();
			out.append('"').append(s.replace("\"", "\"\"")).append('"');
		} else if (e instanceof Expr.VariableAccess) {
			out.append(namer.getName(((Expr.VariableAccess) e).getVariable()));
		} else if (e instanceof Expr.Operator) {
			writeOperator(out, (Expr.Operator) e);
		} else if (e instanceof Expr.Invoke) {
			writeInvoke(out, (Expr.Invoke) e);
		} else if (e instanceof Expr.Quantifier) {
			writeQuantifier(out, (Expr.Quantifier) e);
		} else if (e instanceof Expr.Let) {
			writeLet(out, (Expr.Let) e);
		} else if (e instanceof Expr.Label) {
			writeLabel(out, (Expr.Label) e);
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private void writeInteger(StringBuilder out, Expr.Integer e) {
		BigInteger v = e.getValue();
		if (v.signum() < 0) {
			out.append("(- ").append(v.negate().toString()).append(")");
		} else {
			out.append(v.toString());
		}
	}

	private void writeDecimal(StringBuilder out, Expr.Decimal e) {
		BigDecimal v = e.getValue();
		String s = v.abs().toPlainString();
		if (s.indexOf('.') < 0) {
			s = s + ".0";
		}
		if (v.signum() < 0) {
			out.append("(- ").append(s).append(")");
		} else {
			out.append(s);
		}
	}

	private void writeBitVector(StringBuilder out, Expr.BitVector e) {
		out.append("(_ bv").append(e.getValue().toString()).append(" ").append(e.getWidth()).append(")");
	}

	private void writeOperator(StringBuilder out, Expr.Operator e) {
		List<Expr> operands = e.getOperands();
		switch (e.getKind()) {
		case AND:
			writeNary(out, "and", "true", operands);
			break;
		case OR:
			writeNary(out, "or", "false", operands);
			break;
		case DISTINCT:
			if (operands.size() < 2) {
				out.append("true");
			} else {
				writeApplication(out, "distinct", operands);
			}
			break;
		default:
			writeApplication(out, getOperatorName(e.getKind()), operands);
		}
	}

	private void writeNary(StringBuilder out, String name, String unit, List<Expr> operands) {
		if (operands.isEmpty()) {
			out.append(unit);
		} else if (operands.size() == 1) {
			writeExpr(out, operands.get(0));
		} else {
			writeApplication(out, name, operands);
		}
	}

	private void writeInvoke(StringBuilder out, Expr.Invoke e) {
		if (!e.getTypeArguments().isEmpty()) {
			throw new IllegalArgumentException("polymorphic invocation of " + e.getFunction().getName());
		}
		String name = namer.getName(e.getFunction());
		if (e.getArguments().isEmpty()) {
			out.append(name);
		} else {
			writeApplication(out, name, e.getArguments());
		}
	}

	private void writeApplication(StringBuilder out, String name, List<Expr> operands) {
		out.append("(").append(name);
		for (Expr operand : operands) {
			out.append(" ");
			writeExpr(out, operand);
		}
		out.append(")");
	}

	private void writeQuantifier(StringBuilder out, Expr.Quantifier e) {
		if (!e.getTypeParameters().isEmpty()) {
			throw new IllegalArgumentException("polymorphic quantifier encountered");
		} else if (e.getParameters().isEmpty()) {
			writeExpr(out, e.getBody());
			return;
		}
		out.append(e.isUniversal() ? "(forall (" : "(exists (");
		List<Logic.Variable> parameters = e.getParameters();
		for (int i = 0; i != parameters.size(); ++i) {
			Logic.Variable v = parameters.get(i);
			if (i != 0) {
				out.append(" ");
			}
			out.append("(").append(namer.getName(v)).append(" ").append(toString(v.getType(), namer)).append(")");
		}
		out.append(") ");
		boolean weighted = useWeights && e.getWeight() != 1;
		boolean named = useZ3 && (e.getQid() != null || e.getSkolemId() >= 0);
		if (e.getTriggers().isEmpty() && !weighted && !named) {
			writeExpr(out, e.getBody());
		} else {
			out.append("(! ");
			writeExpr(out, e.getBody());
			for (List<Expr> trigger : e.getTriggers()) {
				out.append(" :pattern (");
				for (int i = 0; i != trigger.size(); ++i) {
					if (i != 0) {
						out.append(" ");
					}
					writeExpr(out, trigger.get(i));
				}
				out.append(")");
			}
			if (useZ3 && e.getQid() != null) {
				out.append(" :qid ").append(SMTLibNamer.quoteId(e.getQid()));
			}
			if (useZ3 && e.getSkolemId() >= 0) {
				out.append(" :skolemid |").append(e.getSkolemId()).append("|");
			}
			if (weighted) {
				out.append(" :weight ").append(e.getWeight());
			}
			out.append(")");
		}
		out.append(")");
	}

	private void writeLet(StringBuilder out, Expr.Let e) {
		List<Expr.Binding> bindings = e.getBindings();
		if (bindings.isEmpty()) {
			writeExpr(out, e.getBody());
			return;
		}
		out.append("(let (");
		for (int i = 0; i != bindings.size(); ++i) {
			Expr.Binding b = bindings.get(i);
			if (i != 0) {
				out.append(" ");
			}
			out.append("(").append(namer.getName(b.getVariable())).append(" ");
			writeExpr(out, b.getValue());
			out.append(")");
		}
		out.append(") ");
		writeExpr(out, e.getBody());
		out.append(")");
	}

	private void writeLabel(StringBuilder out, Expr.Label e) {
		if (useZ3) {
			out.append("(! ");
			writeExpr(out, e.getBody());
			out.append(e.isPositive() ? " :lblpos " : " :lblneg ").append(SMTLibNamer.quoteId(e.getName()));
			out.append(")");
		} else {
			writeExpr(out, e.getBody());
		}
	}

	private static String getOperatorName(Expr.Operator.Kind kind) {
		switch (kind) {
		case NOT:
			return "not";
		case IMPLIES:
			return "=>";
		case IFF:
		case EQ:
			return "=";
		case ITE:
			return "ite";
		case LT:
			return "<";
		case LTEQ:
			return "<=";
		case GT:
			return ">";
		case GTEQ:
			return ">=";
		case ADD:
			return "+";
		case SUB:
		case NEG:
			return "-";
		case MUL:
			return "*";
		case DIV:
			return "div";
		case MOD:
			return "mod";
		case RDIV:
			return "/";
		case SELECT:
			return "select";
		case STORE:
			return "store";
		default:
			throw new IllegalArgumentException("unknown operator encountered (" + kind + ")");
		}
	}
}
