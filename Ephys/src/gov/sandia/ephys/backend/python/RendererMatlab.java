/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.backend.python;

import gov.sandia.ephys.language.MissingConfigurationException;
import gov.sandia.ephys.language.function.Floor;
import gov.sandia.ephys.language.function.Log;
import gov.sandia.ephys.language.operator.AND;
import gov.sandia.ephys.language.operator.Divide;
import gov.sandia.ephys.language.operator.Modulo;
import gov.sandia.ephys.language.operator.NE;
import gov.sandia.ephys.language.operator.NOT;
import gov.sandia.ephys.language.operator.OR;
import gov.sandia.ephys.language.operator.Power;
import gov.sandia.ephys.language.operator.Quotient;

/**
    Renders expressions as Matlab or Octave code.
    The language has no inline conditional, so the caller must name a function
    f(condition, value_if_true, value_if_false) and define it alongside the generated code.
**/
public class RendererMatlab extends RendererPython
{
    public RendererMatlab (String conditionFunction)
    {
        functionPrefix = "";
        setConditionFunction (conditionFunction);
    }

    public void setConditionFunction (String conditionFunction)
    {
        if (conditionFunction != null) conditionFunction = conditionFunction.trim ();
        if (conditionFunction == null  ||  conditionFunction.isEmpty ()) throw new MissingConfigurationException ("conditionFunction", "Matlab");
        this.conditionFunction = conditionFunction;
    }

    public String print (double d)
    {
        if (Double.isNaN (d)) return "NaN";
        if (Double.isInfinite (d)) return d < 0 ? "-Inf" : "Inf";
        return super.print (d);
    }

    public String render (Quotient op)
    {
        return new Floor (new Divide (op.operand0, op.operand1)).render (this);
    }

    // mod() takes the sign of the divisor, which matches flooring division.
    public String render (Modulo op)
    {
        return function ("mod", op.operand0, op.operand1);
    }

    public String render (Power op) {return infix (op, "^");}

    public String render (NE op)  {return condition (op, "~=");}
    public String render (AND op) {return condition (op, "&&");}
    public String render (OR op)  {return condition (op, "||");}
    public String render (NOT op) {return negation (op, "~");}

    public String render (Log op)
    {
        if (op.hasBase ()) return changeOfBase (op);
        return super.render (op);
    }
}
