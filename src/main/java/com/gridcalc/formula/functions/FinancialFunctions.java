package com.gridcalc.formula.functions;

import com.gridcalc.exceptions.FormulaException;
import com.gridcalc.models.ErrorKind;
import com.gridcalc.models.Value;

import java.util.List;

/**
 * Annuity, cash-flow and depreciation functions. Arguments follow the Lotus
 * order, e.g. PMT(principal, rate, periods), not the Excel one.
 */
final class FinancialFunctions {

    private static final int MAX_ITERATIONS = 100;
    private static final double TOLERANCE = 1e-10;

    private FinancialFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register("PMT", FinancialFunctions::pmt);
        registry.register("PV", FinancialFunctions::pv);
        registry.register("FV", FinancialFunctions::fv);
        registry.register("NPV", FinancialFunctions::npv);
        registry.register("IRR", FinancialFunctions::irr);
        registry.register("RATE", FinancialFunctions::rate);
        registry.register("NPER", FinancialFunctions::nper);
        registry.register("CTERM", FinancialFunctions::cterm);
        registry.register("TERM", FinancialFunctions::term);
        registry.register("SLN", FinancialFunctions::sln);
        registry.register("SYD", FinancialFunctions::syd);
        registry.register("DDB", FinancialFunctions::ddb);
        registry.register("IPMT", (args, ctx) -> paymentSplit(args, true));
        registry.register("PPMT", (args, ctx) -> paymentSplit(args, false));
    }

    static double payment(double principal, double rate, double periods) {
        if (periods == 0) {
            throw new FormulaException(ErrorKind.DIV_ZERO);
        }
        if (rate == 0) {
            return principal / periods;
        }
        double growth = Math.pow(1 + rate, periods);
        return principal * rate * growth / (growth - 1);
    }

    private static Value pmt(List<Value> args, FunctionContext ctx) {
        Args.require(args, 3, 3);
        return Value.number(payment(Args.number(args, 0), Args.number(args, 1), Args.number(args, 2)));
    }

    private static Value pv(List<Value> args, FunctionContext ctx) {
        Args.require(args, 3, 3);
        double pmt = Args.number(args, 0);
        double rate = Args.number(args, 1);
        double periods = Args.number(args, 2);
        if (rate == 0) {
            return Value.number(pmt * periods);
        }
        return Value.number(pmt * (1 - Math.pow(1 + rate, -periods)) / rate);
    }

    private static Value fv(List<Value> args, FunctionContext ctx) {
        Args.require(args, 3, 3);
        double pmt = Args.number(args, 0);
        double rate = Args.number(args, 1);
        double periods = Args.number(args, 2);
        if (rate == 0) {
            return Value.number(pmt * periods);
        }
        return Value.number(pmt * (Math.pow(1 + rate, periods) - 1) / rate);
    }

    /**
     * NPV(rate, flows...): the first flow is discounted one full period.
     */
    private static Value npv(List<Value> args, FunctionContext ctx) {
        Args.require(args, 2, -1);
        double rate = Args.number(args, 0);
        List<Double> flows = Args.numbers(args.subList(1, args.size()));
        double total = 0;
        for (int i = 0; i < flows.size(); i++) {
            total += flows.get(i) / Math.pow(1 + rate, i + 1);
        }
        return Value.number(total);
    }

    /**
     * IRR(guess, flows...) by Newton-Raphson; no convergence is #ERR!.
     */
    private static Value irr(List<Value> args, FunctionContext ctx) {
        Args.require(args, 2, -1);
        double rate = Args.number(args, 0, 0.1);
        List<Double> flows = Args.numbers(args.subList(1, args.size()));
        if (flows.isEmpty()) {
            throw new FormulaException(ErrorKind.ERR, "No cash flows");
        }
        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            double value = 0;
            double derivative = 0;
            for (int i = 0; i < flows.size(); i++) {
                value += flows.get(i) / Math.pow(1 + rate, i);
                derivative -= i * flows.get(i) / Math.pow(1 + rate, i + 1);
            }
            if (Math.abs(derivative) < TOLERANCE) {
                break;
            }
            double next = rate - value / derivative;
            if (Math.abs(next - rate) < TOLERANCE) {
                return Value.number(next);
            }
            rate = next;
        }
        throw new FormulaException(ErrorKind.ERR, "IRR did not converge");
    }

    /**
     * RATE(periods, pmt, pv, [fv], [guess]) by Newton-Raphson.
     */
    private static Value rate(List<Value> args, FunctionContext ctx) {
        Args.require(args, 3, 5);
        double periods = Args.number(args, 0);
        double pmt = Args.number(args, 1);
        double present = Args.number(args, 2);
        double future = Args.number(args, 3, 0);
        double rate = Args.number(args, 4, 0.1);
        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            double y;
            double dy;
            if (rate == 0) {
                y = present + pmt * periods + future;
                dy = 0;
            } else {
                double growth = Math.pow(1 + rate, periods);
                y = present * growth + pmt * (growth - 1) / rate + future;
                dy = present * periods * Math.pow(1 + rate, periods - 1)
                        + pmt * (periods * Math.pow(1 + rate, periods - 1) * rate - (growth - 1)) / (rate * rate);
            }
            if (Math.abs(dy) < TOLERANCE) {
                break;
            }
            double next = rate - y / dy;
            if (Math.abs(next - rate) < TOLERANCE) {
                return Value.number(next);
            }
            rate = next;
        }
        return Value.number(rate);
    }

    private static Value nper(List<Value> args, FunctionContext ctx) {
        Args.require(args, 3, 4);
        double rate = Args.number(args, 0);
        double pmt = Args.number(args, 1);
        double present = Args.number(args, 2);
        double future = Args.number(args, 3, 0);
        if (rate == 0) {
            if (pmt == 0) {
                throw new FormulaException(ErrorKind.DIV_ZERO);
            }
            return Value.number(-(present + future) / pmt);
        }
        return Value.number(Math.log((pmt - future * rate) / (pmt + present * rate)) / Math.log(1 + rate));
    }

    private static Value cterm(List<Value> args, FunctionContext ctx) {
        Args.require(args, 3, 3);
        double rate = Args.number(args, 0);
        double future = Args.number(args, 1);
        double present = Args.number(args, 2);
        if (rate <= 0 || present <= 0 || future <= 0) {
            throw new FormulaException(ErrorKind.ERR, "CTERM needs positive arguments");
        }
        return Value.number(Math.log(future / present) / Math.log(1 + rate));
    }

    private static Value term(List<Value> args, FunctionContext ctx) {
        Args.require(args, 3, 3);
        double pmt = Args.number(args, 0);
        double rate = Args.number(args, 1);
        double future = Args.number(args, 2);
        if (pmt == 0) {
            throw new FormulaException(ErrorKind.DIV_ZERO);
        }
        if (rate == 0) {
            return Value.number(future / pmt);
        }
        return Value.number(Math.log(1 + future * rate / pmt) / Math.log(1 + rate));
    }

    private static Value sln(List<Value> args, FunctionContext ctx) {
        Args.require(args, 3, 3);
        double life = Args.number(args, 2);
        if (life == 0) {
            throw new FormulaException(ErrorKind.DIV_ZERO);
        }
        return Value.number((Args.number(args, 0) - Args.number(args, 1)) / life);
    }

    private static Value syd(List<Value> args, FunctionContext ctx) {
        Args.require(args, 4, 4);
        double cost = Args.number(args, 0);
        double salvage = Args.number(args, 1);
        int life = Args.integer(args, 2);
        int period = Args.integer(args, 3);
        if (life <= 0 || period <= 0 || period > life) {
            throw new FormulaException(ErrorKind.ERR, "Period outside the asset life");
        }
        double sumOfYears = life * (life + 1) / 2.0;
        return Value.number((cost - salvage) * (life - period + 1) / sumOfYears);
    }

    /**
     * DDB(cost, salvage, life, period, [factor]); book value never drops below salvage.
     */
    private static Value ddb(List<Value> args, FunctionContext ctx) {
        Args.require(args, 4, 5);
        double cost = Args.number(args, 0);
        double salvage = Args.number(args, 1);
        double life = Args.number(args, 2);
        int period = Args.integer(args, 3);
        double factor = Args.number(args, 4, 2);
        if (life <= 0 || period <= 0) {
            throw new FormulaException(ErrorKind.ERR, "Life and period must be positive");
        }
        double rate = factor / life;
        double book = cost;
        for (int i = 1; i < period; i++) {
            book -= book * rate;
            if (book < salvage) {
                book = salvage;
                break;
            }
        }
        double depreciation = book * rate;
        if (book - depreciation < salvage) {
            depreciation = book - salvage;
        }
        return Value.number(Math.max(0, depreciation));
    }

    /**
     * IPMT/PPMT(rate, period, periods, pv): the interest or principal part of one payment.
     */
    private static Value paymentSplit(List<Value> args, boolean interest) {
        Args.require(args, 4, 4);
        double rate = Args.number(args, 0);
        int period = Args.integer(args, 1);
        int periods = Args.integer(args, 2);
        double present = Args.number(args, 3);
        if (period < 1 || period > periods) {
            throw new FormulaException(ErrorKind.ERR, "Period outside the loan term");
        }
        double pmt = payment(present, rate, periods);
        double remaining;
        if (rate == 0) {
            remaining = present - (period - 1) * pmt;
        } else {
            double growth = Math.pow(1 + rate, period - 1);
            remaining = present * growth - pmt * (growth - 1) / rate;
        }
        double interestPart = remaining * rate;
        return Value.number(interest ? interestPart : pmt - interestPart);
    }
}
