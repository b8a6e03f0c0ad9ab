/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.backend.c;

import gov.sandia.ephys.language.Constant;
import gov.sandia.ephys.language.Operator;
import gov.sandia.ephys.language.OperatorBinary;
import gov.sandia.ephys.language.operator.NE;
import gov.sandia.ephys.language.operator.Power;

/**
    Shared base for GPU kernel languages. Kernels are compiled with strict typing of truth values,
    so any number used as a condition is converted with an explicit comparison against zero.
    Squares are expanded into a multiplication, since they are common in rate equations and a
    call to pow() is comparatively slow.
**/
public abstract class RendererGPU extends RendererC
{
    protected final boolean nativeMath;

    protected RendererGPU (Precision precision, boolean nativeMath)
    {
        super (precision);
        this.nativeMath = nativeMath;
    }

    public boolean getNativeMath ()
    {
        return nativeMath;
    }

    public String truth (Operator op)
    {
        if (op.isCondition ()) return op.render (this);
        return new NE (op, new Constant (0)).render (this);
    }

    /**
        A comparison between a condition and a number compares them both as truth values.
    **/
    public String comparison (OperatorBinary op, String middle)
    {
        boolean c0 = op.operand0.isCondition ();
        boolean c1 = op.operand1.isCondition ();
        if (c0 == c1) return super.comparison (op, middle);
        return "(" + truth (op.operand0) + " " + middle + " " + truth (op.operand1) + ")";
    }

    public String render (Power op)
    {
        if (op.operand1 instanceof Constant  &&  ((Constant) op.operand1).value == 2)
        {
            Operator a = op.operand0;
            String base = a.render (this);
            if (op.bracket (a)) return "((" + base + ") * (" + base + "))";
            return "(" + base + " * " + base + ")";
        }
        return super.render (op);
    }
}
