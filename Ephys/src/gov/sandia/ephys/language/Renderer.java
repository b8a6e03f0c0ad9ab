/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.language;

import gov.sandia.ephys.language.function.AbsoluteValue;
import gov.sandia.ephys.language.function.Acos;
import gov.sandia.ephys.language.function.Asin;
import gov.sandia.ephys.language.function.Atan;
import gov.sandia.ephys.language.function.Ceil;
import gov.sandia.ephys.language.function.Cosine;
import gov.sandia.ephys.language.function.Exp;
import gov.sandia.ephys.language.function.Floor;
import gov.sandia.ephys.language.function.If;
import gov.sandia.ephys.language.function.Log;
import gov.sandia.ephys.language.function.Log10;
import gov.sandia.ephys.language.function.Piecewise;
import gov.sandia.ephys.language.function.Sine;
import gov.sandia.ephys.language.function.SquareRoot;
import gov.sandia.ephys.language.function.Tangent;
import gov.sandia.ephys.language.operator.AND;
import gov.sandia.ephys.language.operator.Add;
import gov.sandia.ephys.language.operator.Divide;
import gov.sandia.ephys.language.operator.EQ;
import gov.sandia.ephys.language.operator.GE;
import gov.sandia.ephys.language.operator.GT;
import gov.sandia.ephys.language.operator.LE;
import gov.sandia.ephys.language.operator.LT;
import gov.sandia.ephys.language.operator.Modulo;
import gov.sandia.ephys.language.operator.Multiply;
import gov.sandia.ephys.language.operator.NE;
import gov.sandia.ephys.language.operator.NOT;
import gov.sandia.ephys.language.operator.Negate;
import gov.sandia.ephys.language.operator.OR;
import gov.sandia.ephys.language.operator.Power;
import gov.sandia.ephys.language.operator.Quotient;
import gov.sandia.ephys.language.operator.Subtract;
import gov.sandia.ephys.language.operator.UnaryPlus;

/**
    A visitor over the expression tree which produces a value of type T for each node.
    There is one overload per node class. Operator.render() in each class picks the overload
    for its own type, so a backend only implements the kinds its target language can express.
    Every overload left alone throws UnsupportedKindException.

    <p>Configuration (naming, number formatting, condition function) is set once before use.
    Rendering itself does not change the renderer, so one configured instance may be shared.
**/
public abstract class Renderer<T>
{
    /**
        Produces the identifier for a variable reference, derivative, partial derivative or initial value.
    **/
    public interface NameFunction
    {
        public String name (OperatorLHS lhs);
    }

    /**
        Produces the text of a numeric literal.
    **/
    public interface NumberFormat
    {
        public String format (Constant c);
    }

    public static final NameFunction defaultNames = lhs -> lhs.toString ();

    protected NameFunction nameFunction = defaultNames;
    protected NumberFormat numberFormat;       // null means the backend's own formatting
    protected String       conditionFunction;  // null means the backend's inline conditional form

    public void setNameFunction (NameFunction nameFunction)
    {
        if (nameFunction == null) this.nameFunction = defaultNames;
        else                      this.nameFunction = nameFunction;
    }

    public NameFunction getNameFunction ()
    {
        return nameFunction;
    }

    public void setNumberFormat (NumberFormat numberFormat)
    {
        this.numberFormat = numberFormat;
    }

    public NumberFormat getNumberFormat ()
    {
        return numberFormat;
    }

    /**
        Names a function of the form f(condition, then, else) that replaces the inline conditional.
        Pass null to return to the inline form.
    **/
    public void setConditionFunction (String conditionFunction)
    {
        this.conditionFunction = conditionFunction;
    }

    public String getConditionFunction ()
    {
        return conditionFunction;
    }

    public String name (OperatorLHS lhs)
    {
        return nameFunction.name (lhs);
    }

    protected UnsupportedKindException unsupported (Operator op)
    {
        return new UnsupportedKindException (op, getClass ().getSimpleName ());
    }

    /**
        Fallback for node classes that have no overload of their own.
    **/
    public T render (Operator op)
    {
        throw unsupported (op);
    }

    // Leaves and left-hand sides

    public T render (AccessVariable op)    {throw unsupported (op);}
    public T render (Derivative op)        {throw unsupported (op);}
    public T render (PartialDerivative op) {throw unsupported (op);}
    public T render (InitialValue op)      {throw unsupported (op);}
    public T render (Constant op)          {throw unsupported (op);}

    // Arithmetic

    public T render (UnaryPlus op) {throw unsupported (op);}
    public T render (Negate op)    {throw unsupported (op);}
    public T render (Add op)       {throw unsupported (op);}
    public T render (Subtract op)  {throw unsupported (op);}
    public T render (Multiply op)  {throw unsupported (op);}
    public T render (Divide op)    {throw unsupported (op);}
    public T render (Quotient op)  {throw unsupported (op);}
    public T render (Modulo op)    {throw unsupported (op);}
    public T render (Power op)     {throw unsupported (op);}

    // Conditions

    public T render (EQ op)  {throw unsupported (op);}
    public T render (NE op)  {throw unsupported (op);}
    public T render (GT op)  {throw unsupported (op);}
    public T render (LT op)  {throw unsupported (op);}
    public T render (GE op)  {throw unsupported (op);}
    public T render (LE op)  {throw unsupported (op);}
    public T render (NOT op) {throw unsupported (op);}
    public T render (AND op) {throw unsupported (op);}
    public T render (OR op)  {throw unsupported (op);}

    // Functions

    public T render (SquareRoot op)    {throw unsupported (op);}
    public T render (Exp op)           {throw unsupported (op);}
    public T render (Log op)           {throw unsupported (op);}
    public T render (Log10 op)         {throw unsupported (op);}
    public T render (Sine op)          {throw unsupported (op);}
    public T render (Cosine op)        {throw unsupported (op);}
    public T render (Tangent op)       {throw unsupported (op);}
    public T render (Asin op)          {throw unsupported (op);}
    public T render (Acos op)          {throw unsupported (op);}
    public T render (Atan op)          {throw unsupported (op);}
    public T render (Floor op)         {throw unsupported (op);}
    public T render (Ceil op)          {throw unsupported (op);}
    public T render (AbsoluteValue op) {throw unsupported (op);}
    public T render (If op)            {throw unsupported (op);}
    public T render (Piecewise op)     {throw unsupported (op);}
}
