/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.pinn.expr;

import java.util.List;

/**
 * Operators available in {@link Operation} nodes.
 * <p>
 * {@link #ADD} and {@link #MULTIPLY} are n-ary; every other operator has a
 * fixed arity.
 * </p>
 */
public enum Operator {

    ADD("+", -1) {
        @Override
        public double apply(double[] args) {
            double sum = 0;
            for (double a : args) sum += a;
            return sum;
        }
    },

    SUBTRACT("-", 2) {
        @Override
        public double apply(double[] args) {
            return args[0] - args[1];
        }
    },

    MULTIPLY("*", -1) {
        @Override
        public double apply(double[] args) {
            double product = 1;
            for (double a : args) product *= a;
            return product;
        }
    },

    DIVIDE("/", 2) {
        @Override
        public double apply(double[] args) {
            return args[0] / args[1];
        }
    },

    POWER("^", 2) {
        @Override
        public double apply(double[] args) {
            return Math.pow(args[0], args[1]);
        }
    },

    NEGATE("-", 1) {
        @Override
        public double apply(double[] args) {
            return -args[0];
        }

        @Override
        String render(List<Expression> args) {
            return "-(" + args.get(0) + ")";
        }
    },

    SIN("sin", 1) {
        @Override
        public double apply(double[] args) {
            return Math.sin(args[0]);
        }
    },

    COS("cos", 1) {
        @Override
        public double apply(double[] args) {
            return Math.cos(args[0]);
        }
    },

    TAN("tan", 1) {
        @Override
        public double apply(double[] args) {
            return Math.tan(args[0]);
        }
    },

    EXP("exp", 1) {
        @Override
        public double apply(double[] args) {
            return Math.exp(args[0]);
        }
    },

    LOG("log", 1) {
        @Override
        public double apply(double[] args) {
            return Math.log(args[0]);
        }
    },

    SQRT("sqrt", 1) {
        @Override
        public double apply(double[] args) {
            return Math.sqrt(args[0]);
        }
    },

    TANH("tanh", 1) {
        @Override
        public double apply(double[] args) {
            return Math.tanh(args[0]);
        }
    },

    ABS("abs", 1) {
        @Override
        public double apply(double[] args) {
            return Math.abs(args[0]);
        }
    };

    private final String symbol;
    private final int arity;

    Operator(String symbol, int arity) {
        this.symbol = symbol;
        this.arity = arity;
    }

    /**
     * Applies the operator to evaluated arguments.
     * @param args Argument values (length accepted by {@link #accepts(int)})
     * @return Result
     */
    public abstract double apply(double[] args);

    /**
     * Gets the printed symbol or function name.
     * @return Symbol
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Gets the fixed arity.
     * @return Arity, or -1 for n-ary operators
     */
    public int getArity() {
        return arity;
    }

    /**
     * Checks whether the operator takes the given number of arguments.
     * @param count Argument count
     * @return true if accepted
     */
    public boolean accepts(int count) {
        return arity < 0 ? count >= 1 : count == arity;
    }

    String render(List<Expression> args) {
        if (arity == 1) {
            return symbol + "(" + args.get(0) + ")";
        }
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(' ').append(symbol).append(' ');
            sb.append(args.get(i));
        }
        return sb.append(')').toString();
    }
}
