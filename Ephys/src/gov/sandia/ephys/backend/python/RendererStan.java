/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.backend.python;

import gov.sandia.ephys.language.MissingConfigurationException;
import gov.sandia.ephys.language.Operator;
import gov.sandia.ephys.language.function.Floor;
import gov.sandia.ephys.language.function.Log;
import gov.sandia.ephys.language.operator.AND;
import gov.sandia.ephys.language.operator.Divide;
import gov.sandia.ephys.language.operator.Modulo;
import gov.sandia.ephys.language.operator.Multiply;
import gov.sandia.ephys.language.operator.NOT;
import gov.sandia.ephys.language.operator.OR;
import gov.sandia.ephys.language.operator.Power;
import gov.sandia.ephys.language.operator.Quotient;
import gov.sandia.ephys.language.operator.Subtract;

/**
    Renders expressions in the Stan modeling language. Stan's "%" works only on integers,
    so remainder is built from floor(). A condition function must be supplied, as for Matlab.
**/
public class RendererStan extends RendererPython
{
    public RendererStan (String conditionFunction)
    {
        functionPrefix = "";
        setConditionFunction (conditionFunction);
    }

    public void setConditionFunction (String conditionFunction)
    {
        if (conditionFunction != null) conditionFunction = conditionFunction.trim ();
        if (conditionFunction == null  ||  conditionFunction.isEmpty ()) throw new MissingConfigurationException ("conditionFunction", "Stan");
        this.conditionFunction = conditionFunction;
    }

    public String print (double d)
    {
        if (Double.isNaN (d)) return "not_a_number()";
        if (Double.isInfinite (d)) return d < 0 ? "negative_infinity()" : "positive_infinity()";
        return super.print (d);
    }

    public String render (Quotient op)
    {
        return new Floor (new Divide (op.operand0, op.operand1)).render (this);
    }

    public String render (Modulo op)
    {
        Operator a = op.operand0;
        Operator b = op.operand1;
        return "(" + new Subtract (a, new Multiply (b, new Floor (new Divide (a, b)))).render (this) + ")";
    }

    public String render (Power op) {return infix (op, "^");}

    public String render (AND op) {return condition (op, "&&");}
    public String render (OR op)  {return condition (op, "||");}
    public String render (NOT op) {return negation (op, "!");}

    public String render (Log op)
    {
        if (op.hasBase ()) return changeOfBase (op);
        return super.render (op);
    }
}
