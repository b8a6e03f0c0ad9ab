/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.backend.python;

import gov.sandia.ephys.language.Operator;
import gov.sandia.ephys.language.function.Acos;
import gov.sandia.ephys.language.function.Asin;
import gov.sandia.ephys.language.function.Atan;
import gov.sandia.ephys.language.function.If;
import gov.sandia.ephys.language.function.Log;
import gov.sandia.ephys.language.function.Piecewise;

/**
    Renders expressions as Python over NumPy arrays. Every function goes through the numpy module,
    and conditionals become numpy.select(), which evaluates element by element.
**/
public class RendererNumPy extends RendererPython
{
    public RendererNumPy ()
    {
        functionPrefix = "numpy.";
    }

    public String render (Asin op) {return function (math ("arcsin"), op.getOperand (0));}
    public String render (Acos op) {return function (math ("arccos"), op.getOperand (0));}
    public String render (Atan op) {return function (math ("arctan"), op.getOperand (0));}

    public String render (Log op)
    {
        // numpy.log() takes no base. Its second parameter is the output array.
        if (op.hasBase ()) return changeOfBase (op);
        return super.render (op);
    }

    public String render (If op)
    {
        return select (new Operator[] {op.condition ()}, new Operator[] {op.value ()}, op.otherwise ());
    }

    public String render (Piecewise op)
    {
        int count = op.conditionCount ();
        Operator[] conditions = new Operator[count];
        Operator[] values     = new Operator[count];
        for (int i = 0; i < count; i++)
        {
            conditions[i] = op.condition (i);
            values[i]     = op.value (i);
        }
        return select (conditions, values, op.otherwise ());
    }

    public String select (Operator[] conditions, Operator[] values, Operator otherwise)
    {
        StringBuilder result = new StringBuilder ();
        result.append (math ("select"));
        result.append ("([");
        list (result, conditions);
        result.append ("], [");
        list (result, values);
        result.append ("], ");
        result.append (otherwise.render (this));
        result.append (")");
        return result.toString ();
    }

    protected void list (StringBuilder result, Operator[] items)
    {
        for (int i = 0; i < items.length; i++)
        {
            if (i > 0) result.append (", ");
            result.append (items[i].render (this));
        }
    }
}
