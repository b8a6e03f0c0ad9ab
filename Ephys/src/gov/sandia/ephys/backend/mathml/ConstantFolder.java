/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.backend.mathml;

import gov.sandia.ephys.language.Constant;
import gov.sandia.ephys.language.Operator;
import gov.sandia.ephys.language.Renderer;
import gov.sandia.ephys.language.UnsupportedKindException;
import gov.sandia.ephys.language.function.Exp;
import gov.sandia.ephys.language.operator.Add;
import gov.sandia.ephys.language.operator.Divide;
import gov.sandia.ephys.language.operator.Multiply;
import gov.sandia.ephys.language.operator.Negate;
import gov.sandia.ephys.language.operator.Power;
import gov.sandia.ephys.language.operator.Subtract;
import gov.sandia.ephys.language.operator.UnaryPlus;

/**
    Computes the value of small constant expressions, such as the contents of a logbase or degree element.
**/
class ConstantFolder extends Renderer<Double>
{
    protected static final ConstantFolder instance = new ConstantFolder ();

    /**
        @return The value of the expression, or null if it depends on anything other than numbers.
    **/
    public static Double fold (Operator op)
    {
        try
        {
            return op.render (instance);
        }
        catch (UnsupportedKindException e)
        {
            return null;  // refers to a variable or uses a function we don't fold
        }
    }

    public Double render (Constant op)  {return op.value;}
    public Double render (UnaryPlus op) {return op.operand.render (this);}
    public Double render (Negate op)    {return -op.operand.render (this);}
    public Double render (Add op)       {return op.operand0.render (this) + op.operand1.render (this);}
    public Double render (Subtract op)  {return op.operand0.render (this) - op.operand1.render (this);}
    public Double render (Multiply op)  {return op.operand0.render (this) * op.operand1.render (this);}
    public Double render (Divide op)    {return op.operand0.render (this) / op.operand1.render (this);}
    public Double render (Power op)     {return Math.pow (op.operand0.render (this), op.operand1.render (this));}
    public Double render (Exp op)       {return Math.exp (op.getOperand (0).render (this));}
}
