// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import java.lang.invoke.MethodHandle;
import java.lang.ref.Reference;
import java.lang.reflect.Executable;
import java.lang.reflect.Modifier;
import java.nio.Buffer;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Exchanger;
import java.util.concurrent.Flow;
import java.util.concurrent.Future;

/// The categories of type the codec refuses to represent.
public enum ForbiddenKind {
  /// `void` and `Void`
  NO_TYPE("no type"),
  /// Handles onto memory or onto other objects rather than values: [Reference] and [Buffer]
  ADDRESS("raw address"),
  /// Hand-off points between threads: queues, futures, exchangers, flow publishers
  CHANNEL("concurrency channel"),
  /// Lambdas, functional interfaces, methods and method handles
  CALLABLE("callable"),
  /// Anything whose concrete type is only known at runtime: `Object`, interfaces, abstract
  /// classes, type variables, wildcards and raw containers
  DYNAMIC("dynamically typed value");

  private static final List<Class<?>> ADDRESS_TYPES = List.of(Reference.class, Buffer.class);

  private static final List<Class<?>> CHANNEL_TYPES = List.of(
      BlockingQueue.class, Exchanger.class, Future.class, CompletionStage.class,
      Flow.Publisher.class, Flow.Subscriber.class);

  private static final List<Class<?>> CALLABLE_TYPES = List.of(
      Runnable.class, Callable.class, Executable.class, MethodHandle.class);

  private final String description;

  ForbiddenKind(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }

  /// Classify a class into one of the kinds that are forbidden whatever the context.
  /// [#DYNAMIC] is not considered here as registered handlers may still claim such a type.
  static Optional<ForbiddenKind> concrete(Class<?> clazz) {
    if (clazz == void.class || clazz == Void.class) {
      return Optional.of(NO_TYPE);
    }
    if (ADDRESS_TYPES.stream().anyMatch(t -> t.isAssignableFrom(clazz))) {
      return Optional.of(ADDRESS);
    }
    if (CHANNEL_TYPES.stream().anyMatch(t -> t.isAssignableFrom(clazz))) {
      return Optional.of(CHANNEL);
    }
    if (clazz.isSynthetic() || clazz.isHidden() || isFunctional(clazz)
        || CALLABLE_TYPES.stream().anyMatch(t -> t.isAssignableFrom(clazz))) {
      return Optional.of(CALLABLE);
    }
    return Optional.empty();
  }

  /// True when the static type does not pin down the concrete class of its values
  static boolean isDynamic(Class<?> clazz) {
    if (clazz == Object.class) {
      return true;
    }
    if (clazz.isPrimitive() || clazz.isArray() || clazz.isEnum()) {
      return false;
    }
    return clazz.isInterface() || Modifier.isAbstract(clazz.getModifiers());
  }

  private static boolean isFunctional(Class<?> clazz) {
    if (!clazz.isInterface()) {
      return false;
    }
    if (clazz.isAnnotationPresent(FunctionalInterface.class)) {
      return true;
    }
    return Arrays.stream(clazz.getInterfaces()).anyMatch(ForbiddenKind::isFunctional);
  }
}
