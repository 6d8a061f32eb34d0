package com.dataflow.sdg;

import com.dataflow.sdg.api.FrameworkDriver;
import com.dataflow.sdg.api.NextStore;
import com.dataflow.sdg.config.Configuration;
import com.dataflow.sdg.model.ProductStore;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

import lombok.extern.log4j.Log4j2;

/**
 * Adapts a user source class to the {@link NextStore} entry point.
 *
 * <p>
 * The source object is created once, through a constructor taking a
 * {@link Configuration} if the class has one, otherwise through its no-arg
 * constructor. Its callable is chosen by what the class offers:
 * <ul>
 * <li>{@code next(FrameworkDriver)}: driver-aware, called once with the
 * driver;</li>
 * <li>{@code ProductStore next()}: called until it returns null, every store
 * it returns is yielded;</li>
 * <li>{@code void next()}: the root store is yielded and {@code next()} is
 * called once.</li>
 * </ul>
 */
@Log4j2
public final class SourceFactory {

    private SourceFactory() {
    }

    public static NextStore create(Class<?> type) {
        return create(type, Configuration.empty());
    }

    /**
     * @throws IllegalArgumentException if the class has no usable constructor
     *                                  or no {@code next} method
     */
    public static NextStore create(Class<?> type, Configuration config) {
        Object source = instantiate(type, config);

        Method driverAware = findMethod(type, FrameworkDriver.class);
        if (driverAware != null) {
            log.debug("Source {} is driver-aware", type.getName());
            return driver -> call(driverAware, source, driver);
        }
        Method agnostic = findMethod(type);
        if (agnostic == null)
            throw new IllegalArgumentException("Source " + type.getName()
                    + " must declare next(FrameworkDriver) or next()");

        if (ProductStore.class.isAssignableFrom(agnostic.getReturnType())) {
            return driver -> {
                ProductStore store;
                while ((store = (ProductStore) call(agnostic, source)) != null)
                    driver.yield(store);
            };
        }
        return driver -> {
            driver.yield(ProductStore.base(type.getSimpleName()));
            call(agnostic, source);
        };
    }

    private static Object instantiate(Class<?> type, Configuration config) {
        try {
            try {
                Constructor<?> ctor = type.getDeclaredConstructor(Configuration.class);
                ctor.setAccessible(true);
                return ctor.newInstance(config);
            } catch (NoSuchMethodException e) {
                Constructor<?> ctor = type.getDeclaredConstructor();
                ctor.setAccessible(true);
                return ctor.newInstance();
            }
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException("Source " + type.getName()
                    + " needs a (Configuration) or a no-arg constructor", e);
        } catch (InvocationTargetException e) {
            throw rethrow("Constructing source " + type.getName() + " failed", e);
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Cannot instantiate source " + type.getName(), e);
        }
    }

    private static Method findMethod(Class<?> type, Class<?>... parameterTypes) {
        try {
            Method m = type.getMethod("next", parameterTypes);
            m.setAccessible(true);
            return m;
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    private static Object call(Method method, Object target, Object... args) {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw rethrow("Source " + target.getClass().getName() + " failed", e);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot call " + method, e);
        }
    }

    private static RuntimeException rethrow(String message, InvocationTargetException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException re)
            return re;
        if (cause instanceof Error err)
            throw err;
        return new IllegalStateException(message, cause);
    }
}
